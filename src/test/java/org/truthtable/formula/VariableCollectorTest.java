package org.truthtable.formula;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.truthtable.formula.FormulaNode.*;

/**
 * Test per VariableCollector.
 */
class VariableCollectorTest {

    private final VariableCollector collector = new VariableCollector();

    @Test
    @DisplayName("Visita in profondità, sinistra prima di destra")
    void shouldCollectInDepthFirstOrder() {
        FormulaNode formula = or(and(variable('C'), not(variable('A'))), implies(variable('B'), literal(true)));

        assertEquals(List.of('C', 'A', 'B'), collector.collect(formula));
    }

    @Test
    @DisplayName("collect mantiene le occorrenze ripetute")
    void shouldKeepDuplicateOccurrences() {
        FormulaNode formula = xor(variable('A'), and(variable('B'), variable('A')));

        assertEquals(List.of('A', 'B', 'A'), collector.collect(formula));
    }

    @Test
    @DisplayName("collectDistinct tiene solo la prima occorrenza")
    void shouldDeduplicateKeepingFirstOccurrence() {
        FormulaNode formula = xor(variable('B'), and(variable('A'), variable('B')));

        assertEquals(List.of('B', 'A'), collector.collectDistinct(formula));
    }

    @Test
    @DisplayName("Le costanti non contribuiscono variabili")
    void shouldIgnoreLiterals() {
        assertTrue(collector.collect(and(literal(true), not(literal(false)))).isEmpty());
    }
}
