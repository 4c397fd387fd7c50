package org.truthtable.table;

import org.truthtable.exception.VariableLimitExceededException;
import org.truthtable.formula.FormulaEvaluator;
import org.truthtable.formula.FormulaNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * ENUMERATORE ASSEGNAMENTI - Tutte le 2^n combinazioni di valori di verità
 *
 * La riga i assegna alla variabile in posizione k il valore ((i >> k) & 1) != 0:
 * la prima variabile alterna a ogni riga, l'ultima cambia una sola volta a metà
 * tabella. Con zero variabili si ottiene una sola riga con assegnamento vuoto.
 *
 * Le posizioni sono indipendenti: se la lista contiene un carattere ripetuto,
 * l'occorrenza più a destra sovrascrive le precedenti nell'assegnamento.
 *
 * LIMITI:
 * • Il numero di righe cresce come 2^n, quindi le liste più lunghe del limite
 *   configurato vengono rifiutate
 * • Il limite non può superare {@link #MAX_VARIABLE_LIMIT}: con 2^20 righe compatte
 *   (indice e risultato) la tabella occupa poche decine di MB
 */
public class AssignmentEnumerator {

    private static final Logger LOGGER = Logger.getLogger(AssignmentEnumerator.class.getName());

    /** Limite di default sulle variabili (65536 righe) */
    public static final int DEFAULT_VARIABLE_LIMIT = 16;

    /** Limite massimo configurabile (circa un milione di righe) */
    public static final int MAX_VARIABLE_LIMIT = 20;

    private final FormulaEvaluator evaluator;
    private final int variableLimit;

    public AssignmentEnumerator() {
        this(new FormulaEvaluator(), DEFAULT_VARIABLE_LIMIT);
    }

    /**
     * @param evaluator valutatore delle righe
     * @param variableLimit numero massimo di variabili (1..MAX_VARIABLE_LIMIT)
     * @throws IllegalArgumentException se il limite è fuori intervallo
     */
    public AssignmentEnumerator(FormulaEvaluator evaluator, int variableLimit) {
        if (evaluator == null) {
            throw new IllegalArgumentException("Valutatore non può essere null");
        }
        if (variableLimit < 1 || variableLimit > MAX_VARIABLE_LIMIT) {
            throw new IllegalArgumentException("Limite variabili fuori intervallo [1, "
                    + MAX_VARIABLE_LIMIT + "]: " + variableLimit);
        }
        this.evaluator = evaluator;
        this.variableLimit = variableLimit;
    }

    public int getVariableLimit() {
        return variableLimit;
    }

    /**
     * Valuta la formula sotto ogni assegnamento delle variabili.
     *
     * @param formula albero da valutare
     * @param variables variabili in ordine di colonna
     * @return esattamente 2^|variables| righe, in ordine di indice
     * @throws VariableLimitExceededException se le variabili superano il limite
     */
    public List<TruthTableRow> enumerate(FormulaNode formula, List<Character> variables)
            throws VariableLimitExceededException {
        if (variables.size() > variableLimit) {
            throw new VariableLimitExceededException(variables.size(), variableLimit);
        }

        int rowCount = 1 << variables.size();
        LOGGER.fine("Enumerazione di " + rowCount + " assegnamenti su " + variables);

        List<Character> columns = List.copyOf(variables);
        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        for (int rowIndex = 0; rowIndex < rowCount; rowIndex++) {
            Map<Character, Boolean> assignment = buildAssignment(columns, rowIndex);
            rows.add(new TruthTableRow(columns, rowIndex, evaluator.evaluate(formula, assignment)));
        }
        return rows;
    }

    /**
     * Costruisce l'assegnamento della riga indicata.
     *
     * @param variables variabili in ordine di colonna
     * @param rowIndex indice di riga, da 0 a 2^n - 1
     * @return assegnamento nell'ordine delle variabili
     */
    public Map<Character, Boolean> assignmentFor(List<Character> variables, int rowIndex) {
        return buildAssignment(variables, rowIndex);
    }

    static Map<Character, Boolean> buildAssignment(List<Character> variables, int rowIndex) {
        Map<Character, Boolean> assignment = new LinkedHashMap<>();
        for (int position = 0; position < variables.size(); position++) {
            assignment.put(variables.get(position), bitAt(rowIndex, position));
        }
        return assignment;
    }

    static boolean bitAt(int rowIndex, int position) {
        return ((rowIndex >> position) & 1) != 0;
    }
}
