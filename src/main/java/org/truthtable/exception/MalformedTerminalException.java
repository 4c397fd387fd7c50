package org.truthtable.exception;

/**
 * Sottostringa che non è né un gruppo, né uno split su operatore, né un
 * terminale di un solo carattere.
 */
public class MalformedTerminalException extends FormulaException {

    private final String text;

    public MalformedTerminalException(String text) {
        super("Impossibile creare un nodo da `" + text + "`");
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
