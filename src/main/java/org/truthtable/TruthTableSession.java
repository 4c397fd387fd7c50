package org.truthtable;

import org.truthtable.exception.FormulaException;
import org.truthtable.preprocess.SynonymSubstitutor;
import org.truthtable.table.TruthTable;
import org.truthtable.table.TruthTableGenerator;
import org.truthtable.table.TruthTableRenderer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.logging.Logger;

/**
 * SESSIONE - Ciclo di elaborazione di una sequenza di formule, una per riga
 *
 * Per ogni riga non vuota: sostituzione dei sinonimi, generazione della tabella,
 * stampa. Una formula rifiutata produce un messaggio [E] e non interrompe le
 * righe successive. Le violazioni di invarianti interne (eccezioni non
 * controllate) risalgono al chiamante.
 */
public class TruthTableSession {

    private static final Logger LOGGER = Logger.getLogger(TruthTableSession.class.getName());

    private final SynonymSubstitutor substitutor;
    private final TruthTableGenerator generator;
    private final TruthTableRenderer renderer;
    private final boolean showStatistics;

    public TruthTableSession(TruthTableGenerator generator, boolean showStatistics) {
        this(new SynonymSubstitutor(), generator, new TruthTableRenderer(), showStatistics);
    }

    public TruthTableSession(SynonymSubstitutor substitutor, TruthTableGenerator generator,
                             TruthTableRenderer renderer, boolean showStatistics) {
        if (substitutor == null || generator == null || renderer == null) {
            throw new IllegalArgumentException("Componenti della sessione non possono essere null");
        }
        this.substitutor = substitutor;
        this.generator = generator;
        this.renderer = renderer;
        this.showStatistics = showStatistics;
    }

    /**
     * Elabora tutte le righe fino alla fine del flusso.
     *
     * @param input sorgente delle formule
     * @param output destinazione di tabelle e messaggi
     * @return conteggio di formule elaborate e rifiutate
     * @throws IOException se la lettura dell'input fallisce
     */
    public SessionResult process(BufferedReader input, PrintStream output) throws IOException {
        int processed = 0;
        int rejected = 0;
        int lineNumber = 0;

        String line;
        while ((line = input.readLine()) != null) {
            lineNumber++;

            if (line.isBlank()) {
                LOGGER.finest("Riga " + lineNumber + " vuota, ignorata");
                continue;
            }

            if (processLine(line, lineNumber, output)) {
                processed++;
            } else {
                rejected++;
            }
        }

        LOGGER.info("Sessione completata: " + processed + " formule elaborate, " + rejected + " rifiutate");
        return new SessionResult(processed, rejected);
    }

    /**
     * @return true se la tabella è stata generata, false se la formula è rifiutata
     */
    private boolean processLine(String line, int lineNumber, PrintStream output) {
        String formula = substitutor.substitute(line);

        try {
            TruthTable table = generator.generate(formula);
            renderer.render(table, output);
            output.println("[I] " + table.classify().getLabel());

            if (showStatistics) {
                output.print(table.getStatistics());
            }
            output.println();
            return true;

        } catch (FormulaException e) {
            LOGGER.warning("Riga " + lineNumber + " rifiutata: " + e.getMessage());
            output.println("[E] Formula rifiutata `" + line + "`: " + e.getMessage());
            output.println();
            return false;
        }
    }

    /**
     * Esito di una sessione.
     */
    public static final class SessionResult {
        private final int processedCount;
        private final int rejectedCount;

        public SessionResult(int processedCount, int rejectedCount) {
            this.processedCount = processedCount;
            this.rejectedCount = rejectedCount;
        }

        public int getProcessedCount() {
            return processedCount;
        }

        public int getRejectedCount() {
            return rejectedCount;
        }

        public int getTotalCount() {
            return processedCount + rejectedCount;
        }
    }
}
