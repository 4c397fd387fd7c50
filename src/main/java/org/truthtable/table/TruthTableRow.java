package org.truthtable.table;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Riga della tabella: assegnamento delle variabili e valore della formula.
 *
 * La riga conserva solo l'indice e la lista di variabili condivisa con le altre
 * righe; l'assegnamento viene ricavato dai bit dell'indice quando richiesto.
 */
public final class TruthTableRow {

    private final List<Character> variables;
    private final int rowIndex;
    private final boolean result;

    /**
     * @param variables variabili in ordine di colonna, condivise tra le righe
     * @param rowIndex indice di riga, da 0 a 2^n - 1
     * @param result valore della formula sotto l'assegnamento della riga
     */
    public TruthTableRow(List<Character> variables, int rowIndex, boolean result) {
        if (variables == null) {
            throw new IllegalArgumentException("Variabili non possono essere null");
        }
        if (rowIndex < 0 || rowIndex >= 1 << variables.size()) {
            throw new IllegalArgumentException("Indice di riga fuori intervallo: " + rowIndex);
        }
        this.variables = variables;
        this.rowIndex = rowIndex;
        this.result = result;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    /**
     * @return assegnamento immutabile, nell'ordine delle variabili
     */
    public Map<Character, Boolean> getAssignment() {
        return Collections.unmodifiableMap(AssignmentEnumerator.buildAssignment(variables, rowIndex));
    }

    public boolean getResult() {
        return result;
    }

    /**
     * @param variable variabile della riga
     * @return valore assegnato (l'occorrenza più a destra, se ripetuta)
     * @throws IllegalArgumentException se la variabile non appartiene alla riga
     */
    public boolean valueOf(char variable) {
        int position = variables.lastIndexOf(variable);
        if (position < 0) {
            throw new IllegalArgumentException("Variabile " + variable + " assente dalla riga");
        }
        return AssignmentEnumerator.bitAt(rowIndex, position);
    }

    /**
     * @param position posizione di colonna
     * @return valore del bit della riga in quella posizione
     */
    public boolean valueAt(int position) {
        if (position < 0 || position >= variables.size()) {
            throw new IndexOutOfBoundsException("Posizione fuori intervallo: " + position);
        }
        return AssignmentEnumerator.bitAt(rowIndex, position);
    }

    @Override
    public String toString() {
        return getAssignment() + " -> " + (result ? "T" : "F");
    }
}
