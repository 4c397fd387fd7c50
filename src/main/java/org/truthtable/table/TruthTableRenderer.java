package org.truthtable.table;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * RENDERER - Formattazione testuale di una {@link TruthTable}
 *
 * FORMATO:
 * <pre>
 * ｜ A ｜ B ｜ A∧B ｜
 * -----------------
 * ｜ F ｜ F ｜  F  ｜
 * ...
 * -----------------
 * </pre>
 * Una colonna per variabile più la colonna del risultato, centrato sotto la
 * formula. I valori sono T / F. Le lunghezze sono misurate in code point.
 */
public class TruthTableRenderer {

    private static final String BAR = "｜";
    private static final String SEPARATOR = "-";

    /**
     * @param table tabella da formattare
     * @return testo della tabella, righe terminate da '\n'
     */
    public String render(TruthTable table) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream output = new PrintStream(buffer, false, StandardCharsets.UTF_8);
        render(table, output);
        output.flush();
        return buffer.toString(StandardCharsets.UTF_8);
    }

    /**
     * Scrive la tabella riga per riga, senza costruirne in memoria il testo completo.
     *
     * @param table tabella da formattare
     * @param output destinazione del testo
     */
    public void render(TruthTable table, PrintStream output) {
        String formula = table.getFormula();
        List<Character> variables = table.getVariables();
        int formulaLength = formula.codePointCount(0, formula.length());

        StringBuilder line = new StringBuilder();

        // Intestazione
        line.append(BAR).append(' ');
        for (char variable : variables) {
            line.append(variable).append(' ').append(BAR).append(' ');
        }
        line.append(formula).append(' ').append(BAR).append('\n');
        output.print(line);

        String separator = SEPARATOR.repeat(variables.size() * 5 + formulaLength + 5);
        output.print(separator + '\n');

        // Colonna -> posizione che ne determina il valore
        int[] positions = new int[variables.size()];
        for (int column = 0; column < positions.length; column++) {
            positions[column] = variables.lastIndexOf(variables.get(column));
        }

        String padding = " ".repeat(Math.max(0, (formulaLength - 1) / 2));
        for (TruthTableRow row : table.getRows()) {
            line.setLength(0);
            line.append(BAR);
            for (int position : positions) {
                line.append(' ').append(symbol(row.valueAt(position))).append(' ').append(BAR);
            }
            line.append(' ').append(padding).append(symbol(row.getResult())).append(padding)
                    .append(' ').append(BAR).append('\n');
            output.print(line);
        }

        output.print(separator + '\n');
    }

    private static char symbol(boolean value) {
        return value ? 'T' : 'F';
    }
}
