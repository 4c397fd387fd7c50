package org.truthtable.exception;

/**
 * ECCEZIONE FORMULA - Radice degli errori recuperabili su una singola formula
 *
 * Ogni sottoclasse descrive un motivo per cui una riga di input viene rifiutata
 * nella sua interezza: raggruppamento sbilanciato, operando mancante, terminale
 * malformato o troppe variabili. Il chiamante scarta la riga e prosegue con la
 * successiva, senza terminare il processo.
 */
public class FormulaException extends Exception {

    public FormulaException(String message) {
        super(message);
    }

    public FormulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
