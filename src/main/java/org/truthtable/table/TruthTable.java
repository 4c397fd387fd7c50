package org.truthtable.table;

import org.truthtable.formula.FormulaNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * TABELLA DI VERITÀ - Risultato immutabile dell'elaborazione di una formula
 *
 * Contiene ciò che serve al renderer: la formula in forma simbolica, l'albero,
 * le variabili nell'ordine delle colonne e le righe in ordine di indice.
 */
public final class TruthTable {

    private final String formula;
    private final FormulaNode root;
    private final List<Character> variables;
    private final List<TruthTableRow> rows;
    private final TruthTableStatistics statistics;

    /**
     * Costruttore semplificato senza statistiche esplicite.
     */
    public TruthTable(String formula, FormulaNode root, List<Character> variables, List<TruthTableRow> rows) {
        this(formula, root, variables, rows, new TruthTableStatistics());
    }

    public TruthTable(String formula, FormulaNode root, List<Character> variables, List<TruthTableRow> rows,
                      TruthTableStatistics statistics) {
        if (formula == null || root == null || variables == null || rows == null || statistics == null) {
            throw new IllegalArgumentException("Componenti della tabella non possono essere null");
        }
        if (rows.size() != 1 << variables.size()) {
            throw new IllegalArgumentException("Attese " + (1 << variables.size())
                    + " righe per " + variables.size() + " variabili, ricevute " + rows.size());
        }

        this.formula = formula;
        this.root = root;
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.statistics = statistics;
    }

    public String getFormula() {
        return formula;
    }

    public FormulaNode getRoot() {
        return root;
    }

    public List<Character> getVariables() {
        return variables;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public TruthTableStatistics getStatistics() {
        return statistics;
    }

    public int countTrueRows() {
        int count = 0;
        for (TruthTableRow row : rows) {
            if (row.getResult()) count++;
        }
        return count;
    }

    /**
     * Classifica la formula in base al numero di righe vere.
     */
    public FormulaClassification classify() {
        int trueRows = countTrueRows();
        if (trueRows == rows.size()) {
            return FormulaClassification.TAUTOLOGY;
        }
        if (trueRows == 0) {
            return FormulaClassification.CONTRADICTION;
        }
        return FormulaClassification.CONTINGENCY;
    }
}
