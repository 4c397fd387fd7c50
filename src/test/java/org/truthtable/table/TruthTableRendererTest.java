package org.truthtable.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.truthtable.exception.FormulaException;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test per TruthTableRenderer.
 */
class TruthTableRendererTest {

    private final TruthTableGenerator generator = new TruthTableGenerator();
    private final TruthTableRenderer renderer = new TruthTableRenderer();

    @Test
    @DisplayName("Tabella di A∧B con intestazione, separatori e risultato centrato")
    void shouldRenderConjunction() throws FormulaException {
        String separator = "-".repeat(18);
        String expected = "｜ A ｜ B ｜ A∧B ｜\n"
                + separator + "\n"
                + "｜ F ｜ F ｜  F  ｜\n"
                + "｜ T ｜ F ｜  F  ｜\n"
                + "｜ F ｜ T ｜  F  ｜\n"
                + "｜ T ｜ T ｜  T  ｜\n"
                + separator + "\n";

        assertEquals(expected, renderer.render(generator.generate("A∧B")));
    }

    @Test
    @DisplayName("Formula senza variabili: sola colonna del risultato")
    void shouldRenderConstant() throws FormulaException {
        String expected = "｜ ⊤ ｜\n"
                + "------\n"
                + "｜ T ｜\n"
                + "------\n";

        assertEquals(expected, renderer.render(generator.generate("⊤")));
    }

    @Test
    @DisplayName("Una riga per assegnamento più intestazione e due separatori")
    void shouldRenderOneLinePerRow() throws FormulaException {
        String output = renderer.render(generator.generate("(A→B)=C"));

        assertEquals(8 + 3, output.split("\n").length);
        assertTrue(output.startsWith("｜ A ｜ B ｜ C ｜ (A→B)=C ｜\n"));
    }

    @Test
    @DisplayName("Scrittura su stream identica al testo restituito")
    void shouldWriteSameTextToStream() throws FormulaException {
        TruthTable table = generator.generate("A⊕¬B");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        renderer.render(table, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(renderer.render(table), buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Formula al limite massimo di variabili generata e scritta su stream")
    void shouldRenderFormulaAtMaximumVariableLimit() throws FormulaException {
        int limit = AssignmentEnumerator.MAX_VARIABLE_LIMIT;
        StringBuilder formula = new StringBuilder("a");
        for (int i = 1; i < limit; i++) {
            formula.append('∧').append((char) ('a' + i));
        }

        TruthTable table = new TruthTableGenerator(limit).generate(formula.toString());
        CountingOutputStream counter = new CountingOutputStream();
        renderer.render(table, new PrintStream(counter, false, StandardCharsets.UTF_8));

        assertEquals(1 << limit, table.getRows().size());
        assertEquals(1, table.countTrueRows());
        assertEquals(FormulaClassification.CONTINGENCY, table.classify());
        assertEquals((1 << limit) + 3, counter.lines);
    }

    /**
     * Conta le righe scritte senza conservarne il contenuto.
     */
    private static final class CountingOutputStream extends OutputStream {
        private int lines;

        @Override
        public void write(int b) {
            if (b == '\n') lines++;
        }
    }
}
