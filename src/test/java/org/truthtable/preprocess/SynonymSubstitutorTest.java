package org.truthtable.preprocess;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test per SynonymSubstitutor.
 */
class SynonymSubstitutorTest {

    private final SynonymSubstitutor substitutor = new SynonymSubstitutor();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "A and B            | A ∧ B",
            "A or B             | A ∨ B",
            "not A              | ¬ A",
            "A xor B            | A ⊕ B",
            "A imply B          | A → B",
            "A implies B        | A → B",
            "A equals B         | A = B",
            "A notequals B      | A ≠ B",
            "true or false      | ⊤ ∨ ⊥",
            "(A and B) or not C | (A ∧ B) ∨ ¬ C"
    })
    @DisplayName("Ogni sinonimo diventa il proprio simbolo")
    void shouldReplaceSynonyms(String line, String expected) {
        assertEquals(expected, substitutor.substitute(line));
    }

    @Test
    @DisplayName("Sostituisce solo parole intere")
    void shouldReplaceWholeWordsOnly() {
        assertEquals("android ∧ B", substitutor.substitute("android and B"));
        assertEquals("notify", substitutor.substitute("notify"));
        assertEquals("A∧B", substitutor.substitute("A∧B"));
    }

    @Test
    @DisplayName("Il confronto distingue maiuscole e minuscole")
    void shouldBeCaseSensitive() {
        assertEquals("A AND B", substitutor.substitute("A AND B"));
    }

    @Test
    @DisplayName("Parentesi attaccate alle parole non impediscono la sostituzione")
    void shouldReplaceNextToGroups() {
        assertEquals("¬(A ∧ B)", substitutor.substitute("not(A and B)"));
        assertEquals("¬(AandB)", substitutor.substitute("not(AandB)"));
        assertEquals("(⊤)→(⊥)", substitutor.substitute("(true)implies(false)"));
    }

    @Test
    @DisplayName("Riga vuota invariata")
    void shouldKeepEmptyLine() {
        assertEquals("", substitutor.substitute(""));
    }

    @Test
    @DisplayName("Lettere accentate e cifre fanno parte della parola")
    void shouldTreatUnicodeLettersAsWordCharacters() {
        assertEquals("àand B", substitutor.substitute("àand B"));
        assertEquals("andè ∨ B", substitutor.substitute("andè or B"));
        assertEquals("è ∧ ¬ B", substitutor.substitute("è and not B"));
        assertEquals("not2", substitutor.substitute("not2"));
    }
}
