package org.truthtable.exception;

/**
 * La formula contiene più variabili di quante l'enumerazione ne accetti.
 * Le righe crescono come 2^n: oltre il limite la tabella non viene generata.
 */
public class VariableLimitExceededException extends FormulaException {

    private final int variableCount;
    private final int limit;

    public VariableLimitExceededException(int variableCount, int limit) {
        super("Formula con " + variableCount + " variabili: limite massimo " + limit);
        this.variableCount = variableCount;
        this.limit = limit;
    }

    public int getVariableCount() {
        return variableCount;
    }

    public int getLimit() {
        return limit;
    }
}
