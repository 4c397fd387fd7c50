package org.truthtable.parser;

import org.truthtable.exception.FormulaException;
import org.truthtable.exception.MalformedTerminalException;
import org.truthtable.exception.MissingOperandException;
import org.truthtable.exception.NestingDepthExceededException;
import org.truthtable.formula.FormulaNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Discesa ricorsiva guidata dall'ordine di split
 *
 * Converte una formula già in forma simbolica (∧ ∨ ¬ ⊕ → = ≠ ⊤ ⊥) in un
 * {@link FormulaNode}. La precedenza non deriva da regole grammaticali annidate ma
 * dall'ordine in cui gli operatori vengono cercati: l'operatore del primo livello
 * trovato a profondità 0 diventa la radice, quindi gli operatori cercati prima
 * legano meno di quelli cercati dopo.
 *
 * PASSI APPLICATI A OGNI SOTTOSTRINGA:
 * 1. Validazione parentesi (errore fatale per l'intera formula)
 * 2. Trim degli spazi, usato solo per classificare la stringa
 * 3. Rimozione del gruppo esterno ridondante, se l'interno è bilanciato
 * 4. Split binario: livelli in ordine, intervalli a profondità 0 in ordine,
 *    posizioni da sinistra a destra; la prima occorrenza vince
 * 5. Split unario sulla negazione, dopo che tutti i livelli binari sono falliti
 * 6. Terminale di un carattere: ⊤, ⊥ oppure variabile
 * 7. Altrimenti la sottostringa è malformata
 *
 * La ricorsione è limitata a {@link #MAX_NESTING_DEPTH} livelli (gruppi rimossi,
 * negazioni e operandi binari): oltre il limite la formula viene rifiutata.
 *
 * Non esiste backtracking: se uno split trova un operando non valido l'intera
 * formula viene rifiutata. Ogni ricorsione rivalida e risegmenta la propria
 * sottostringa da zero.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /** Profondità massima di ricorsione accettata per una formula */
    public static final int MAX_NESTING_DEPTH = 256;

    private final GroupingValidator groupingValidator;
    private final UngroupedSegmenter segmenter;

    public FormulaParser() {
        this(new GroupingValidator(), new UngroupedSegmenter());
    }

    public FormulaParser(GroupingValidator groupingValidator, UngroupedSegmenter segmenter) {
        if (groupingValidator == null || segmenter == null) {
            throw new IllegalArgumentException("Validatore e segmentatore non possono essere null");
        }
        this.groupingValidator = groupingValidator;
        this.segmenter = segmenter;
    }

    //region PUNTO DI INGRESSO

    /**
     * Costruisce l'albero sintattico della formula.
     *
     * @param formula formula in forma simbolica
     * @return radice dell'albero
     * @throws FormulaException se la formula è sbilanciata, ha operandi mancanti,
     *                          contiene terminali malformati o è annidata oltre
     *                          {@link #MAX_NESTING_DEPTH} livelli
     */
    public FormulaNode parse(String formula) throws FormulaException {
        if (formula == null) {
            throw new IllegalArgumentException("La formula non può essere null");
        }

        LOGGER.fine("Inizio parsing formula: " + formula);
        FormulaNode root = createNode(formula, 0);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Parsing completato -> %s [nodi=%d, profondità=%d]",
                    root, root.countNodes(), root.calculateDepth()));
        }
        return root;
    }

    //endregion

    //region COSTRUZIONE RICORSIVA

    private FormulaNode createNode(String text, int depth) throws FormulaException {
        if (depth > MAX_NESTING_DEPTH) {
            throw new NestingDepthExceededException(MAX_NESTING_DEPTH);
        }
        groupingValidator.validate(text);

        String trimmed = text.trim();

        // Gruppo esterno ridondante: (A∧B) -> A∧B, ma non (A)∧(B)
        if (canBeUngrouped(trimmed)) {
            String interior = trimmed.substring(1, trimmed.length() - 1);
            if (groupingValidator.isBalanced(interior)) {
                LOGGER.finest("Rimozione gruppo esterno: " + trimmed);
                return createNode(interior, depth + 1);
            }
        }

        List<UngroupedRange> ranges = segmenter.ungroupedRanges(text);

        Optional<FormulaNode> binaryNode = splitBinary(text, ranges, depth);
        if (binaryNode.isPresent()) {
            return binaryNode.get();
        }

        Optional<FormulaNode> negationNode = splitNegation(text, ranges, depth);
        if (negationNode.isPresent()) {
            return negationNode.get();
        }

        if (trimmed.length() == 1) {
            return createTerminal(trimmed.charAt(0));
        }

        throw new MalformedTerminalException(text);
    }

    private boolean canBeUngrouped(String trimmed) {
        return trimmed.length() >= 2
                && trimmed.charAt(0) == OperatorTable.OPEN_GROUP
                && trimmed.charAt(trimmed.length() - 1) == OperatorTable.CLOSE_GROUP;
    }

    //endregion

    //region SPLIT SUGLI OPERATORI

    private Optional<FormulaNode> splitBinary(String text, List<UngroupedRange> ranges, int depth)
            throws FormulaException {
        for (Set<BinaryOperator> level : OperatorTable.splitLevels()) {
            for (UngroupedRange range : ranges) {
                for (int index = range.getStart(); index < range.getEnd(); index++) {
                    Optional<BinaryOperator> operator = OperatorTable.binaryOperator(text.charAt(index));

                    if (operator.isEmpty() || !level.contains(operator.get())) {
                        continue;
                    }

                    return Optional.of(createBinaryNode(text, index, operator.get(), depth));
                }
            }
        }
        return Optional.empty();
    }

    private FormulaNode createBinaryNode(String text, int index, BinaryOperator operator, int depth)
            throws FormulaException {
        LOGGER.finest("Split su " + operator.getSymbol() + " in posizione " + index + ": " + text);

        String leftText = text.substring(0, index);
        String rightText = text.substring(index + 1);

        FormulaNode left = createOperand(leftText, operator.getSymbol(), MissingOperandException.Position.LEFT,
                depth);
        FormulaNode right = createOperand(rightText, operator.getSymbol(), MissingOperandException.Position.RIGHT,
                depth);

        return operator.create(left, right);
    }

    private Optional<FormulaNode> splitNegation(String text, List<UngroupedRange> ranges, int depth)
            throws FormulaException {
        for (UngroupedRange range : ranges) {
            for (int index = range.getStart(); index < range.getEnd(); index++) {
                if (text.charAt(index) != OperatorTable.NEGATION) {
                    continue;
                }

                // Nessun operatore binario lega ciò che precede la negazione
                if (!text.substring(0, index).isBlank()) {
                    throw new MalformedTerminalException(text);
                }

                LOGGER.finest("Split su negazione in posizione " + index + ": " + text);
                String operandText = text.substring(index + 1);
                FormulaNode operand = createOperand(operandText, OperatorTable.NEGATION,
                        MissingOperandException.Position.RIGHT, depth);
                return Optional.of(FormulaNode.not(operand));
            }
        }
        return Optional.empty();
    }

    /**
     * Costruisce un operando. Un lato vuoto o ridotto a un terminale malformato
     * diventa un operando mancante dell'operatore; gli errori annidati di altri
     * operatori risalgono invariati.
     */
    private FormulaNode createOperand(String text, char operator, MissingOperandException.Position position,
                                      int depth) throws FormulaException {
        if (text.isBlank()) {
            throw new MissingOperandException(operator, position);
        }

        try {
            return createNode(text, depth + 1);
        } catch (MalformedTerminalException e) {
            throw new MissingOperandException(operator, position, e);
        }
    }

    //endregion

    //region TERMINALI

    private FormulaNode createTerminal(char symbol) {
        return switch (symbol) {
            case OperatorTable.TRUE_CONSTANT -> FormulaNode.literal(true);
            case OperatorTable.FALSE_CONSTANT -> FormulaNode.literal(false);
            default -> FormulaNode.variable(symbol);
        };
    }

    //endregion
}
