package org.truthtable.preprocess;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.truthtable.antlr.SynonymLexer;
import org.truthtable.parser.BinaryOperator;
import org.truthtable.parser.OperatorTable;

import java.util.logging.Logger;

/**
 * SOSTITUZIONE SINONIMI - Da forma testuale a forma simbolica
 *
 * Tokenizza la riga con il lexer ANTLR {@code SynonymLexer} e sostituisce le parole
 * intere riconosciute con il simbolo corrispondente; ogni altro carattere viene
 * copiato invariato.
 *
 * SOSTITUZIONI:
 * • and -> ∧, or -> ∨, not -> ¬, xor -> ⊕
 * • imply, implies -> →
 * • equals -> =, notequals -> ≠
 * • true -> ⊤, false -> ⊥
 *
 * Il confronto è case-sensitive e richiede parole intere: "android" resta
 * invariato, "notequals" diventa ≠ e non ¬=.
 */
public class SynonymSubstitutor {

    private static final Logger LOGGER = Logger.getLogger(SynonymSubstitutor.class.getName());

    /**
     * @param line riga in forma testuale o mista
     * @return riga in forma simbolica
     */
    public String substitute(String line) {
        if (line == null) {
            throw new IllegalArgumentException("La riga non può essere null");
        }

        SynonymLexer lexer = new SynonymLexer(CharStreams.fromString(line));
        lexer.removeErrorListeners();

        StringBuilder output = new StringBuilder(line.length());
        for (Token token = lexer.nextToken(); token.getType() != Token.EOF; token = lexer.nextToken()) {
            output.append(symbolFor(token));
        }

        String result = output.toString();
        if (!result.equals(line)) {
            LOGGER.finest("Sostituzione sinonimi: `" + line + "` -> `" + result + "`");
        }
        return result;
    }

    private String symbolFor(Token token) {
        return switch (token.getType()) {
            case SynonymLexer.AND -> symbol(BinaryOperator.AND);
            case SynonymLexer.OR -> symbol(BinaryOperator.OR);
            case SynonymLexer.XOR -> symbol(BinaryOperator.XOR);
            case SynonymLexer.IMPLIES -> symbol(BinaryOperator.IMPLIES);
            case SynonymLexer.EQUALS -> symbol(BinaryOperator.EQUALS);
            case SynonymLexer.NOTEQUALS -> symbol(BinaryOperator.NOT_EQUALS);
            case SynonymLexer.NOT -> String.valueOf(OperatorTable.NEGATION);
            case SynonymLexer.TRUE -> String.valueOf(OperatorTable.TRUE_CONSTANT);
            case SynonymLexer.FALSE -> String.valueOf(OperatorTable.FALSE_CONSTANT);
            default -> token.getText();
        };
    }

    private static String symbol(BinaryOperator operator) {
        return String.valueOf(operator.getSymbol());
    }
}
