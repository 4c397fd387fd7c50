package org.truthtable.table;

/**
 * Classificazione di una formula ricavata dalle righe della sua tabella.
 */
public enum FormulaClassification {
    TAUTOLOGY("Tautologia"),            // Vera in ogni riga
    CONTRADICTION("Contraddizione"),    // Falsa in ogni riga
    CONTINGENCY("Contingenza");         // Vera in almeno una riga e falsa in almeno una

    private final String label;

    FormulaClassification(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
