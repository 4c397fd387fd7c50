package org.truthtable.exception;

/**
 * Operatore privo di un operando valido su uno dei due lati.
 *
 * La posizione segue la numerazione degli argomenti: LEFT è l'argomento #1,
 * RIGHT l'argomento #2 (per la negazione l'unico operando è RIGHT).
 */
public class MissingOperandException extends FormulaException {

    public enum Position {
        LEFT,
        RIGHT
    }

    private final char operator;
    private final Position position;

    public MissingOperandException(char operator, Position position) {
        super(buildMessage(operator, position));
        this.operator = operator;
        this.position = position;
    }

    public MissingOperandException(char operator, Position position, Throwable cause) {
        super(buildMessage(operator, position) + ": " + cause.getMessage(), cause);
        this.operator = operator;
        this.position = position;
    }

    public char getOperator() {
        return operator;
    }

    public Position getPosition() {
        return position;
    }

    private static String buildMessage(char operator, Position position) {
        int argument = position == Position.LEFT ? 1 : 2;
        return "Operatore " + operator + " privo dell'argomento #" + argument;
    }
}
