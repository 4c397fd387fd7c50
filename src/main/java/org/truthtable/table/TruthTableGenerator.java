package org.truthtable.table;

import org.truthtable.exception.FormulaException;
import org.truthtable.formula.FormulaEvaluator;
import org.truthtable.formula.FormulaNode;
import org.truthtable.formula.VariableCollector;
import org.truthtable.parser.FormulaParser;

import java.util.List;
import java.util.logging.Logger;

/**
 * GENERATORE TABELLE - Pipeline completa da formula simbolica a tabella di verità
 *
 * PIPELINE:
 * 1. Parsing della formula in albero sintattico
 * 2. Raccolta delle variabili distinte in ordine di prima occorrenza
 * 3. Enumerazione dei 2^n assegnamenti e valutazione di ciascuno
 *
 * Ogni variabile distinta corrisponde a una colonna e a un solo bit dell'indice
 * di riga, anche quando compare più volte nella formula.
 */
public class TruthTableGenerator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    private final FormulaParser parser;
    private final VariableCollector collector;
    private final AssignmentEnumerator enumerator;

    public TruthTableGenerator() {
        this(AssignmentEnumerator.DEFAULT_VARIABLE_LIMIT);
    }

    /**
     * @param variableLimit numero massimo di variabili distinte per formula
     */
    public TruthTableGenerator(int variableLimit) {
        this(new FormulaParser(), new VariableCollector(),
                new AssignmentEnumerator(new FormulaEvaluator(), variableLimit));
    }

    public TruthTableGenerator(FormulaParser parser, VariableCollector collector, AssignmentEnumerator enumerator) {
        if (parser == null || collector == null || enumerator == null) {
            throw new IllegalArgumentException("Componenti della pipeline non possono essere null");
        }
        this.parser = parser;
        this.collector = collector;
        this.enumerator = enumerator;
    }

    /**
     * Genera la tabella di verità di una formula in forma simbolica.
     *
     * @param formula formula con operatori già sostituiti
     * @return tabella completa, con statistiche
     * @throws FormulaException se la formula è malformata o ha troppe variabili
     */
    public TruthTable generate(String formula) throws FormulaException {
        TruthTableStatistics statistics = new TruthTableStatistics();

        FormulaNode root = parser.parse(formula);
        statistics.recordParsing(root.countNodes(), root.calculateDepth());

        List<Character> occurrences = collector.collect(root);
        List<Character> variables = collector.collectDistinct(root);
        statistics.recordVariables(occurrences.size(), variables.size());

        List<TruthTableRow> rows = enumerator.enumerate(root, variables);
        TruthTable table = new TruthTable(formula, root, variables, rows, statistics);

        statistics.recordRows(rows.size(), table.countTrueRows());
        statistics.stopTimer();

        LOGGER.fine("Tabella generata per `" + formula + "`: " + statistics.toCompactString());
        return table;
    }
}
