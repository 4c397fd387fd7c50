package org.truthtable.formula;

import org.truthtable.exception.UndefinedVariableException;

import java.util.Map;

/**
 * VALUTATORE - Calcola il valore di verità di un albero sotto un assegnamento
 *
 * SEMANTICA:
 * • A → B ~ ¬A ∨ B
 * • A = B vero se gli operandi coincidono, A ≠ B e A ⊕ B se differiscono
 *
 * Entrambi gli operandi sono sempre valutati. L'assegnamento deve coprire tutte
 * le variabili dell'albero: una variabile mancante è un errore di consistenza,
 * non un valore falso di default.
 */
public class FormulaEvaluator {

    /**
     * @param formula albero da valutare
     * @param assignment valore di ogni variabile referenziata
     * @return valore di verità della formula
     * @throws UndefinedVariableException se una variabile non è assegnata
     */
    public boolean evaluate(FormulaNode formula, Map<Character, Boolean> assignment) {
        return switch (formula.getType()) {
            case LITERAL -> formula.getValue();
            case VARIABLE -> lookup(formula.getVariable(), assignment);
            case NOT -> !evaluate(formula.getOperand(), assignment);
            case AND -> {
                boolean left = evaluate(formula.getLeft(), assignment);
                boolean right = evaluate(formula.getRight(), assignment);
                yield left && right;
            }
            case OR -> {
                boolean left = evaluate(formula.getLeft(), assignment);
                boolean right = evaluate(formula.getRight(), assignment);
                yield left || right;
            }
            case XOR, NOT_EQUALS -> evaluate(formula.getLeft(), assignment) != evaluate(formula.getRight(), assignment);
            case IMPLIES -> {
                boolean antecedent = evaluate(formula.getLeft(), assignment);
                boolean consequent = evaluate(formula.getRight(), assignment);
                yield !antecedent || consequent;
            }
            case EQUALS -> evaluate(formula.getLeft(), assignment) == evaluate(formula.getRight(), assignment);
        };
    }

    private boolean lookup(char variable, Map<Character, Boolean> assignment) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new UndefinedVariableException(variable);
        }
        return value;
    }
}
