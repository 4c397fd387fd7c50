package org.truthtable.table;

/**
 * STATISTICHE TABELLA - Metriche di elaborazione di una singola formula
 *
 * Raccoglie le dimensioni dell'albero, il numero di variabili (occorrenze e
 * distinte), le righe prodotte e i tempi di parsing ed enumerazione.
 * Il timer parte alla costruzione.
 */
public class TruthTableStatistics {

    //region METRICHE STRUTTURALI

    /** Nodi dell'albero sintattico, foglie comprese */
    private int nodeCount = 0;

    /** Profondità dell'albero sintattico */
    private int treeDepth = 0;

    /** Occorrenze di variabili nella formula, ripetizioni incluse */
    private int variableOccurrences = 0;

    /** Variabili distinte, cioè colonne della tabella */
    private int distinctVariables = 0;

    //endregion

    //region METRICHE TABELLA

    private int rowCount = 0;
    private int trueRowCount = 0;

    //endregion

    //region TIMING

    private final long startTime;
    private long parsingTimeMs = 0;
    private long executionTimeMs = 0;
    private boolean parsingCompleted = false;
    private boolean timerStopped = false;

    //endregion

    public TruthTableStatistics() {
        this.startTime = System.currentTimeMillis();
    }

    //region REGISTRAZIONE METRICHE

    /**
     * Registra la fine del parsing e le dimensioni dell'albero.
     * Solo la prima chiamata ha effetto sul tempo di parsing.
     */
    public void recordParsing(int nodeCount, int treeDepth) {
        if (!parsingCompleted) {
            parsingTimeMs = System.currentTimeMillis() - startTime;
            parsingCompleted = true;
        }
        this.nodeCount = nodeCount;
        this.treeDepth = treeDepth;
    }

    public void recordVariables(int occurrences, int distinct) {
        this.variableOccurrences = occurrences;
        this.distinctVariables = distinct;
    }

    public void recordRows(int rowCount, int trueRowCount) {
        this.rowCount = rowCount;
        this.trueRowCount = trueRowCount;
    }

    /**
     * Ferma il timer. Operazione idempotente.
     */
    public void stopTimer() {
        if (!timerStopped) {
            executionTimeMs = System.currentTimeMillis() - startTime;
            timerStopped = true;
        }
    }

    //endregion

    //region ACCESSORS

    public int getNodeCount() {
        return nodeCount;
    }

    public int getTreeDepth() {
        return treeDepth;
    }

    public int getVariableOccurrences() {
        return variableOccurrences;
    }

    public int getDistinctVariables() {
        return distinctVariables;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getTrueRowCount() {
        return trueRowCount;
    }

    public long getParsingTimeMs() {
        return parsingTimeMs;
    }

    /**
     * @return tempo totale in ms; se il timer è ancora attivo, tempo parziale
     */
    public long getExecutionTimeMs() {
        if (!timerStopped) {
            return System.currentTimeMillis() - startTime;
        }
        return executionTimeMs;
    }

    public boolean isTimerStopped() {
        return timerStopped;
    }

    /**
     * @return frazione di righe vere, 0 se la tabella è vuota
     */
    public double getTrueRatio() {
        return rowCount > 0 ? (double) trueRowCount / rowCount : 0.0;
    }

    //endregion

    //region OUTPUT

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();

        output.append("==================[ STATISTICHE FORMULA ]==================\n");
        output.append("    Nodi albero:        ").append(nodeCount).append("\n");
        output.append("    Profondità:         ").append(treeDepth).append("\n");
        output.append("    Variabili:          ").append(distinctVariables);
        if (variableOccurrences != distinctVariables) {
            output.append(" (").append(variableOccurrences).append(" occorrenze)");
        }
        output.append("\n");
        output.append("    Righe:              ").append(rowCount).append("\n");
        output.append("    Righe vere:         ").append(trueRowCount)
                .append(String.format(" (%.1f%%)", getTrueRatio() * 100)).append("\n");
        output.append("    Tempo parsing:      ").append(parsingTimeMs).append("ms\n");
        output.append("    Tempo totale:       ").append(getExecutionTimeMs()).append("ms\n");
        output.append("===========================================================\n");

        return output.toString();
    }

    /**
     * Riepilogo su una riga per il logging.
     */
    public String toCompactString() {
        return String.format("Stats[nodes=%d, depth=%d, vars=%d, rows=%d, true=%d, time=%dms]",
                nodeCount, treeDepth, distinctVariables, rowCount, trueRowCount, getExecutionTimeMs());
    }

    //endregion
}
