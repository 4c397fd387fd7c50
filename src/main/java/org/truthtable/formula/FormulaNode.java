package org.truthtable.formula;

import java.util.Objects;

/**
 * NODO FORMULA - Albero sintattico immutabile di una formula proposizionale
 *
 * Rappresenta la formula come albero chiuso di varianti, selezionate da {@link Type}:
 * costanti, variabili, negazione e i sei operatori binari supportati. Ogni nodo
 * composto possiede in modo esclusivo i propri figli; l'albero non ha riferimenti
 * all'indietro e non viene mai modificato dopo la costruzione.
 *
 * VARIANTI:
 * • LITERAL: costante ⊤ / ⊥
 * • VARIABLE: identificatore di un solo carattere
 * • NOT: negazione, un operando
 * • AND, OR, XOR, IMPLIES, EQUALS, NOT_EQUALS: operatori binari, due operandi
 *
 * COSTRUZIONE:
 * • Solo tramite factory method statici con validazione dei figli
 * • Uguaglianza strutturale per confronto tra alberi
 */
public final class FormulaNode {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati nell'albero.
     */
    public enum Type {
        LITERAL,        // Costante: ⊤, ⊥
        VARIABLE,       // Variabile: A, B, p, ...
        NOT,            // Negazione: ¬A
        AND,            // Congiunzione: A ∧ B
        OR,             // Disgiunzione: A ∨ B
        XOR,            // Disgiunzione esclusiva: A ⊕ B
        IMPLIES,        // Implicazione: A → B
        EQUALS,         // Equivalenza: A = B
        NOT_EQUALS;     // Non equivalenza: A ≠ B

        /**
         * @return true se il tipo richiede due operandi
         */
        public boolean isBinary() {
            return this != LITERAL && this != VARIABLE && this != NOT;
        }
    }

    private final Type type;

    /** Valore della costante (solo LITERAL) */
    private final boolean value;

    /** Carattere della variabile (solo VARIABLE) */
    private final char variable;

    /** Operando della negazione (solo NOT) */
    private final FormulaNode operand;

    /** Operandi sinistro e destro (solo tipi binari) */
    private final FormulaNode left;
    private final FormulaNode right;

    private FormulaNode(Type type, boolean value, char variable,
                        FormulaNode operand, FormulaNode left, FormulaNode right) {
        this.type = type;
        this.value = value;
        this.variable = variable;
        this.operand = operand;
        this.left = left;
        this.right = right;
    }

    //endregion

    //region FACTORY METHOD

    /**
     * Costruisce una costante logica.
     *
     * @param value valore della costante
     * @return nodo LITERAL
     */
    public static FormulaNode literal(boolean value) {
        return new FormulaNode(Type.LITERAL, value, '\0', null, null, null);
    }

    /**
     * Costruisce una variabile proposizionale.
     *
     * @param variable carattere identificativo (non spazio)
     * @return nodo VARIABLE
     * @throws IllegalArgumentException se il carattere è uno spazio
     */
    public static FormulaNode variable(char variable) {
        if (Character.isWhitespace(variable)) {
            throw new IllegalArgumentException("Una variabile non può essere uno spazio");
        }
        return new FormulaNode(Type.VARIABLE, false, variable, null, null, null);
    }

    /**
     * Costruisce la negazione di una sottoformula.
     *
     * @param operand sottoformula da negare (non null)
     * @return nodo NOT
     * @throws IllegalArgumentException se operand null
     */
    public static FormulaNode not(FormulaNode operand) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando per negazione non può essere null");
        }
        return new FormulaNode(Type.NOT, false, '\0', operand, null, null);
    }

    /**
     * Costruisce un nodo binario.
     *
     * @param type tipo binario (AND, OR, XOR, IMPLIES, EQUALS, NOT_EQUALS)
     * @param left operando sinistro (non null)
     * @param right operando destro (non null)
     * @return nodo binario
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static FormulaNode binary(Type type, FormulaNode left, FormulaNode right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operandi di " + type + " non possono essere null");
        }
        return new FormulaNode(type, false, '\0', null, left, right);
    }

    public static FormulaNode and(FormulaNode left, FormulaNode right) {
        return binary(Type.AND, left, right);
    }

    public static FormulaNode or(FormulaNode left, FormulaNode right) {
        return binary(Type.OR, left, right);
    }

    public static FormulaNode xor(FormulaNode left, FormulaNode right) {
        return binary(Type.XOR, left, right);
    }

    public static FormulaNode implies(FormulaNode left, FormulaNode right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static FormulaNode equalsNode(FormulaNode left, FormulaNode right) {
        return binary(Type.EQUALS, left, right);
    }

    public static FormulaNode notEquals(FormulaNode left, FormulaNode right) {
        return binary(Type.NOT_EQUALS, left, right);
    }

    //endregion

    //region ACCESSO

    public Type getType() {
        return type;
    }

    /**
     * @return valore della costante
     * @throws IllegalStateException se il nodo non è LITERAL
     */
    public boolean getValue() {
        requireType(type == Type.LITERAL, "LITERAL");
        return value;
    }

    /**
     * @return carattere della variabile
     * @throws IllegalStateException se il nodo non è VARIABLE
     */
    public char getVariable() {
        requireType(type == Type.VARIABLE, "VARIABLE");
        return variable;
    }

    /**
     * @return operando della negazione
     * @throws IllegalStateException se il nodo non è NOT
     */
    public FormulaNode getOperand() {
        requireType(type == Type.NOT, "NOT");
        return operand;
    }

    public FormulaNode getLeft() {
        requireType(type.isBinary(), "binario");
        return left;
    }

    public FormulaNode getRight() {
        requireType(type.isBinary(), "binario");
        return right;
    }

    private void requireType(boolean condition, String expected) {
        if (!condition) {
            throw new IllegalStateException("Nodo " + type + " non è di tipo " + expected);
        }
    }

    //endregion

    //region METRICHE STRUTTURALI

    /**
     * Calcola la profondità dell'albero (una foglia ha profondità 1).
     */
    public int calculateDepth() {
        return switch (type) {
            case LITERAL, VARIABLE -> 1;
            case NOT -> 1 + operand.calculateDepth();
            default -> 1 + Math.max(left.calculateDepth(), right.calculateDepth());
        };
    }

    /**
     * Conta i nodi dell'albero, foglie comprese.
     */
    public int countNodes() {
        return switch (type) {
            case LITERAL, VARIABLE -> 1;
            case NOT -> 1 + operand.countNodes();
            default -> 1 + left.countNodes() + right.countNodes();
        };
    }

    //endregion

    //region OGGETTO

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof FormulaNode)) return false;

        FormulaNode node = (FormulaNode) other;
        return type == node.type
                && value == node.value
                && variable == node.variable
                && Objects.equals(operand, node.operand)
                && Objects.equals(left, node.left)
                && Objects.equals(right, node.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, variable, operand, left, right);
    }

    /**
     * Rappresentazione infissa con parentesi esplicite su ogni operatore binario.
     */
    @Override
    public String toString() {
        return switch (type) {
            case LITERAL -> value ? "⊤" : "⊥";
            case VARIABLE -> String.valueOf(variable);
            case NOT -> "¬" + operand;
            case AND -> infix("∧");
            case OR -> infix("∨");
            case XOR -> infix("⊕");
            case IMPLIES -> infix("→");
            case EQUALS -> infix("=");
            case NOT_EQUALS -> infix("≠");
        };
    }

    private String infix(String symbol) {
        return "(" + left + " " + symbol + " " + right + ")";
    }

    //endregion
}
