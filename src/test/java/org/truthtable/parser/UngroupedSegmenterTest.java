package org.truthtable.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test per UngroupedSegmenter.
 */
class UngroupedSegmenterTest {

    private final UngroupedSegmenter segmenter = new UngroupedSegmenter();

    @Test
    @DisplayName("Una stringa senza parentesi è un unico intervallo")
    void shouldReturnWholeStringWithoutGroups() {
        assertEquals(List.of(new UngroupedRange(0, 3)), segmenter.ungroupedRanges("A∧B"));
    }

    @Test
    @DisplayName("Un solo gruppo che avvolge tutto non produce intervalli")
    void shouldReturnNoRangesForSingleGroup() {
        assertTrue(segmenter.ungroupedRanges("(A∧B)").isEmpty());
        assertTrue(segmenter.ungroupedRanges("((A))").isEmpty());
    }

    @Test
    @DisplayName("Il tratto si chiude sulla parentesi aperta a profondità 0")
    void shouldCloseRunAtOpeningGroup() {
        assertEquals(List.of(new UngroupedRange(0, 2)), segmenter.ungroupedRanges("A∧(B∨C)"));
    }

    @Test
    @DisplayName("I tratti tra gruppi vengono riportati in ordine")
    void shouldReportRunsBetweenGroups() {
        assertEquals(List.of(new UngroupedRange(3, 4)), segmenter.ungroupedRanges("(A)∧(B)"));
        assertEquals(List.of(new UngroupedRange(0, 1), new UngroupedRange(4, 6)),
                segmenter.ungroupedRanges("¬(A)∨B"));
    }

    @Test
    @DisplayName("Il contenuto dei gruppi annidati resta invisibile")
    void shouldHideNestedContent() {
        List<UngroupedRange> ranges = segmenter.ungroupedRanges("A→((B∧C)∨D)=E");

        assertEquals(List.of(new UngroupedRange(0, 2), new UngroupedRange(11, 13)), ranges);
    }

    @Test
    @DisplayName("Stringa vuota senza intervalli")
    void shouldHandleEmptyString() {
        assertTrue(segmenter.ungroupedRanges("").isEmpty());
    }
}
