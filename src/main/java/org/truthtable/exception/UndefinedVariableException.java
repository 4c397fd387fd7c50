package org.truthtable.exception;

/**
 * Variabile referenziata dall'albero ma assente dall'assegnamento.
 *
 * Non è un errore di input: indica che raccolta variabili ed enumerazione non
 * concordano sull'insieme delle variabili. Per questo è un'eccezione non
 * controllata che interrompe l'esecuzione.
 */
public class UndefinedVariableException extends IllegalStateException {

    private final char variable;

    public UndefinedVariableException(char variable) {
        super("La variabile " + variable + " non ha un valore assegnato");
        this.variable = variable;
    }

    public char getVariable() {
        return variable;
    }
}
