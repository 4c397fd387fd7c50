package org.truthtable.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.truthtable.exception.VariableLimitExceededException;
import org.truthtable.formula.FormulaEvaluator;
import org.truthtable.formula.FormulaNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.truthtable.formula.FormulaNode.*;

/**
 * Test per AssignmentEnumerator.
 */
class AssignmentEnumeratorTest {

    private final AssignmentEnumerator enumerator = new AssignmentEnumerator();

    @Test
    @DisplayName("Zero variabili producono una sola riga con assegnamento vuoto")
    void shouldProduceSingleRowWithoutVariables() throws VariableLimitExceededException {
        List<TruthTableRow> rows = enumerator.enumerate(literal(true), List.of());

        assertEquals(1, rows.size());
        assertTrue(rows.get(0).getAssignment().isEmpty());
        assertTrue(rows.get(0).getResult());
    }

    @Test
    @DisplayName("Il bit k dell'indice di riga pilota la variabile in posizione k")
    void shouldDecomposeRowIndexIntoBits() {
        List<Character> variables = List.of('A', 'B', 'C');

        assertEquals(Map.of('A', false, 'B', false, 'C', false), enumerator.assignmentFor(variables, 0));
        assertEquals(Map.of('A', true, 'B', false, 'C', false), enumerator.assignmentFor(variables, 1));
        assertEquals(Map.of('A', false, 'B', true, 'C', false), enumerator.assignmentFor(variables, 2));
        assertEquals(Map.of('A', true, 'B', false, 'C', true), enumerator.assignmentFor(variables, 5));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 8})
    @DisplayName("Le righe sono esattamente 2^n")
    void shouldProduceTwoToTheNRows(int variableCount) throws VariableLimitExceededException {
        List<Character> variables = new ArrayList<>();
        FormulaNode formula = variable('a');
        variables.add('a');
        for (int i = 1; i < variableCount; i++) {
            char name = (char) ('a' + i);
            variables.add(name);
            formula = or(formula, variable(name));
        }

        assertEquals(1 << variableCount, enumerator.enumerate(formula, variables).size());
    }

    @Test
    @DisplayName("¬A produce A=F→T e A=T→F")
    void shouldEnumerateNegation() throws VariableLimitExceededException {
        List<TruthTableRow> rows = enumerator.enumerate(not(variable('A')), List.of('A'));

        assertEquals(2, rows.size());
        assertFalse(rows.get(0).valueOf('A'));
        assertTrue(rows.get(0).getResult());
        assertTrue(rows.get(1).valueOf('A'));
        assertFalse(rows.get(1).getResult());
    }

    @Test
    @DisplayName("A→B è falsa solo con A vera e B falsa")
    void shouldEnumerateImplication() throws VariableLimitExceededException {
        List<TruthTableRow> rows = enumerator.enumerate(implies(variable('A'), variable('B')), List.of('A', 'B'));

        int falseRows = 0;
        for (TruthTableRow row : rows) {
            if (!row.getResult()) {
                falseRows++;
                assertTrue(row.valueOf('A'));
                assertFalse(row.valueOf('B'));
            }
        }
        assertEquals(1, falseRows);
    }

    @Test
    @DisplayName("Con posizioni ripetute l'occorrenza più a destra sovrascrive le precedenti")
    void shouldOverwriteDuplicatePositions() throws VariableLimitExceededException {
        List<TruthTableRow> rows = enumerator.enumerate(variable('A'), List.of('A', 'A'));

        assertEquals(4, rows.size());
        assertEquals(1, rows.get(1).getAssignment().size());
        assertFalse(rows.get(1).valueOf('A'));
        assertTrue(rows.get(2).valueOf('A'));
    }

    @Test
    @DisplayName("Oltre il limite di variabili l'enumerazione viene rifiutata")
    void shouldRejectTooManyVariables() {
        AssignmentEnumerator limited = new AssignmentEnumerator(new FormulaEvaluator(), 2);

        VariableLimitExceededException error = assertThrows(VariableLimitExceededException.class,
                () -> limited.enumerate(variable('A'), List.of('A', 'B', 'C')));

        assertEquals(3, error.getVariableCount());
        assertEquals(2, error.getLimit());
    }

    @Test
    @DisplayName("Il limite deve essere tra 1 e il massimo consentito")
    void shouldValidateLimit() {
        FormulaEvaluator evaluator = new FormulaEvaluator();

        assertThrows(IllegalArgumentException.class, () -> new AssignmentEnumerator(evaluator, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new AssignmentEnumerator(evaluator, AssignmentEnumerator.MAX_VARIABLE_LIMIT + 1));
        assertEquals(AssignmentEnumerator.DEFAULT_VARIABLE_LIMIT, new AssignmentEnumerator().getVariableLimit());
    }
}
