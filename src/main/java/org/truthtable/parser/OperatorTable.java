package org.truthtable.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * TABELLA OPERATORI - Simboli e ordine di split, inizializzati una sola volta
 *
 * Raggruppa gli operatori binari per livello (dal primo cercato all'ultimo) e
 * definisce i simboli trattati a parte: negazione, costanti e parentesi.
 * Tutte le strutture sono immutabili e condivise dall'intero processo.
 */
public final class OperatorTable {

    public static final char NEGATION = '¬';
    public static final char TRUE_CONSTANT = '⊤';
    public static final char FALSE_CONSTANT = '⊥';
    public static final char OPEN_GROUP = '(';
    public static final char CLOSE_GROUP = ')';

    /**
     * Livelli di split in ordine di ricerca; ogni livello mantiene l'ordine di
     * dichiarazione di {@link BinaryOperator}.
     */
    private static final List<Set<BinaryOperator>> SPLIT_LEVELS = buildSplitLevels();

    private OperatorTable() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    private static List<Set<BinaryOperator>> buildSplitLevels() {
        Map<Integer, Set<BinaryOperator>> byLevel = new TreeMap<>();
        for (BinaryOperator operator : BinaryOperator.values()) {
            byLevel.computeIfAbsent(operator.getLevel(), level -> EnumSet.noneOf(BinaryOperator.class))
                    .add(operator);
        }

        List<Set<BinaryOperator>> levels = new ArrayList<>();
        for (Set<BinaryOperator> level : byLevel.values()) {
            levels.add(Collections.unmodifiableSet(level));
        }
        return Collections.unmodifiableList(levels);
    }

    /**
     * @return livelli di operatori binari, dal primo da cercare all'ultimo
     */
    public static List<Set<BinaryOperator>> splitLevels() {
        return SPLIT_LEVELS;
    }

    /**
     * @param symbol carattere da cercare
     * @return operatore binario con quel simbolo, se esiste
     */
    public static Optional<BinaryOperator> binaryOperator(char symbol) {
        for (BinaryOperator operator : BinaryOperator.values()) {
            if (operator.getSymbol() == symbol) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
