package org.truthtable.exception;

/**
 * Parentesi non bilanciate nella formula (o in una sua sottostringa).
 */
public class UnbalancedGroupingException extends FormulaException {

    /**
     * Tipo di sbilanciamento rilevato dalla scansione.
     */
    public enum Kind {
        NO_OPENING,     // ')' senza '(' corrispondente
        NO_CLOSING      // '(' rimaste aperte a fine stringa
    }

    private final Kind kind;

    public UnbalancedGroupingException(Kind kind, String text) {
        super(describe(kind) + " in `" + text + "`");
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    private static String describe(Kind kind) {
        return switch (kind) {
            case NO_OPENING -> "Parentesi chiusa senza apertura";
            case NO_CLOSING -> "Parentesi aperta senza chiusura";
        };
    }
}
