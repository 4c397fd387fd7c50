package org.truthtable.exception;

/**
 * La formula è annidata oltre la profondità che il parser accetta.
 */
public class NestingDepthExceededException extends FormulaException {

    private final int limit;

    public NestingDepthExceededException(int limit) {
        super("Formula annidata oltre il limite massimo di " + limit + " livelli");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
