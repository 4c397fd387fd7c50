package org.truthtable.formula;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * RACCOLTA VARIABILI - Visita in profondità dell'albero, da sinistra a destra
 *
 * L'ordine delle variabili è quello della prima visita: le costanti non
 * contribuiscono, la negazione scende nel proprio operando, gli operatori binari
 * visitano prima il ramo sinistro e poi il destro.
 *
 * {@link #collect(FormulaNode)} restituisce ogni occorrenza (duplicati inclusi);
 * {@link #collectDistinct(FormulaNode)} tiene solo la prima occorrenza di ciascuna
 * variabile ed è la lista usata per costruire le tabelle.
 */
public class VariableCollector {

    private static final Logger LOGGER = Logger.getLogger(VariableCollector.class.getName());

    /**
     * Raccoglie tutte le occorrenze di variabili, senza deduplicazione.
     *
     * @param formula radice dell'albero
     * @return occorrenze nell'ordine di visita
     */
    public List<Character> collect(FormulaNode formula) {
        List<Character> variables = new ArrayList<>();
        explore(formula, variables);
        return variables;
    }

    /**
     * Raccoglie le variabili distinte nell'ordine della loro prima occorrenza.
     *
     * @param formula radice dell'albero
     * @return variabili distinte
     */
    public List<Character> collectDistinct(FormulaNode formula) {
        Set<Character> distinct = new LinkedHashSet<>(collect(formula));
        LOGGER.finest("Variabili distinte: " + distinct);
        return new ArrayList<>(distinct);
    }

    private void explore(FormulaNode node, List<Character> variables) {
        switch (node.getType()) {
            case LITERAL -> { /* Le costanti non introducono variabili */ }
            case VARIABLE -> variables.add(node.getVariable());
            case NOT -> explore(node.getOperand(), variables);
            default -> {
                explore(node.getLeft(), variables);
                explore(node.getRight(), variables);
            }
        }
    }
}
