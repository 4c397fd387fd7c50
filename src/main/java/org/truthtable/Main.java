package org.truthtable;

import org.truthtable.table.AssignmentEnumerator;
import org.truthtable.table.TruthTableGenerator;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * GENERATORE DI TABELLE DI VERITÀ
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: Una formula per riga, da standard input o da file di testo
 * 2. PREPROCESSING: Sostituzione dei sinonimi testuali (and, or, not, ...) con i simboli
 * 3. PARSING: Costruzione dell'albero sintattico con split guidato dalla precedenza
 * 4. ENUMERAZIONE: Valutazione della formula su tutti i 2^n assegnamenti delle variabili
 * 5. OUTPUT: Tabella formattata, classificazione e statistiche facoltative
 *
 * Una formula malformata viene rifiutata singolarmente: l'elaborazione prosegue
 * con la riga successiva.
 *
 * @version 1.0.0
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String OUTPUT_PARAM = "-o";
    private static final String MAX_VARIABLES_PARAM = "-max";
    private static final String STATS_PARAM = "-s";

    /**
     * Limiti sul numero di variabili per formula
     * */
    private static final int MIN_VARIABLE_LIMIT = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Apertura di input (file o standard input) e output (file o standard output)
     * 3. Elaborazione di tutte le formule tramite {@link TruthTableSession}
     * 4. Riepilogo finale
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        try {
            TableConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        }
    }

    /**
     * Apre le sorgenti configurate ed esegue la sessione di elaborazione.
     *
     * @param config configurazione validata
     * @throws IOException se lettura o scrittura falliscono
     */
    private static void executeMainPipeline(TableConfiguration config) throws IOException {
        TruthTableGenerator generator = new TruthTableGenerator(config.variableLimit);
        TruthTableSession session = new TruthTableSession(generator, config.showStatistics);

        PrintStream output = openOutput(config);
        try (BufferedReader input = openInput(config)) {
            TruthTableSession.SessionResult result = session.process(input, output);
            displaySessionSummary(result, config);
        } finally {
            // Lo standard output resta aperto per i messaggi successivi
            if (config.outputPath != null) {
                output.close();
            } else {
                output.flush();
            }
        }
    }

    private static BufferedReader openInput(TableConfiguration config) throws IOException {
        if (config.inputPath == null) {
            return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        System.out.println("[I] Lettura formule da: " + config.inputPath);
        return Files.newBufferedReader(Path.of(config.inputPath), StandardCharsets.UTF_8);
    }

    private static PrintStream openOutput(TableConfiguration config) throws IOException {
        if (config.outputPath == null) {
            return new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8);
        }
        return new PrintStream(Files.newOutputStream(Path.of(config.outputPath)), true, StandardCharsets.UTF_8);
    }

    /**
     * Mostra il riepilogo solo quando le tabelle sono state scritte su file, per
     * non mescolarlo all'output su console.
     */
    private static void displaySessionSummary(TruthTableSession.SessionResult result, TableConfiguration config) {
        if (config.outputPath == null) {
            return;
        }

        System.out.println("\n-->> RIEPILOGO ELABORAZIONE <<--");
        System.out.println("Formule totali:   " + result.getTotalCount());
        System.out.println("Elaborate:        " + result.getProcessedCount());
        System.out.println("Rifiutate:        " + result.getRejectedCount());
        System.out.println("Output:           " + config.outputPath);
        System.out.println("================================\n");
    }

    /**
     * Gestisce errori critici dell'applicazione con logging completo.
     *
     * @param e eccezione critica che ha causato il fallimento
     */
    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * Analizza e valida tutti i parametri della linea di comando.
     *
     * @param args array di parametri da processare
     * @return configurazione validata o null se help/errore
     */
    private static TableConfiguration parseAndValidateArguments(String[] args) {
        try {
            ArgumentParser parser = new ArgumentParser();
            return parser.parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    /**
     * Visualizza l'help completo dell'applicazione.
     */
    private static void printApplicationHelp() {
        System.out.println("\n::>> GENERATORE DI TABELLE DI VERITÀ <<::");
        System.out.println("Tabelle di verità per formule di logica proposizionale\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar tabella_verita.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -f <file>       Legge le formule da file, una per riga (default: standard input)");
        System.out.println("  -o <file>       Scrive le tabelle su file (default: standard output)");
        System.out.println("  -max <numero>   Numero massimo di variabili per formula ("
                + MIN_VARIABLE_LIMIT + "-" + AssignmentEnumerator.MAX_VARIABLE_LIMIT
                + ", default: " + AssignmentEnumerator.DEFAULT_VARIABLE_LIMIT + ")");
        System.out.println("  -s              Stampa le statistiche di ogni formula");
        System.out.println("  -h              Mostra questa guida\n");

        System.out.println("OPERATORI (simbolo / parola):");
        System.out.println("  ∧  and          ∨  or           ¬  not");
        System.out.println("  ⊕  xor          →  imply, implies");
        System.out.println("  =  equals       ≠  notequals");
        System.out.println("  ⊤  true         ⊥  false\n");

        System.out.println("PRECEDENZA (dal legame più debole al più forte):");
        System.out.println("  → = ≠   poi   ∨ ⊕   poi   ∧   poi   ¬");
        System.out.println("  A parità di livello vince l'operatore più a sinistra.\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  echo \"A and B or not C\" | java -jar tabella_verita.jar\n");
        System.out.println("  java -jar tabella_verita.jar -f formule.txt -o tabelle.txt -s\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Le variabili sono singoli caratteri (A, B, p, q, ...)");
        System.out.println("  - Le righe vuote vengono ignorate");
        System.out.println("  - Una formula malformata viene segnalata con [E] e saltata");
        System.out.println("  - Le righe della tabella sono 2^n: formule oltre il limite -max vengono rifiutate\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class TableConfiguration {
        final String inputPath;
        final String outputPath;
        final int variableLimit;
        final boolean showStatistics;

        TableConfiguration(String inputPath, String outputPath, int variableLimit, boolean showStatistics) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.variableLimit = variableLimit;
            this.showStatistics = showStatistics;
        }
    }

    /**
     * Parser per parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * Processa sequenzialmente tutti i parametri della command line.
         *
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -f <file>: Input da file
         * -o <file>: Output su file
         * -max <n>: Limite variabili per formula
         * -s: Statistiche per formula
         *
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri invalidi
         */
        public TableConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            int variableLimit = AssignmentEnumerator.DEFAULT_VARIABLE_LIMIT;
            boolean showStatistics = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case FILE_PARAM -> {
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }

                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "file output");
                        validateOutputFile(outputPath);
                    }

                    case MAX_VARIABLES_PARAM -> variableLimit = parseAndValidateLimit(args, ++i);

                    case STATS_PARAM -> showStatistics = true;

                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath != null && inputPath.equals(outputPath)) {
                throw new IllegalArgumentException("Input e output non possono coincidere: " + inputPath);
            }

            return new TableConfiguration(inputPath, outputPath, variableLimit, showStatistics);
        }

        /**
         * Verifica che esista un argomento successivo prima di restituirlo.
         */
        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateLimit(String[] args, int currentIndex) {
            String limitStr = getNextArgument(args, currentIndex, "numero variabili");

            int limit;
            try {
                limit = Integer.parseInt(limitStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore limite non valido: " + limitStr);
            }

            if (limit < MIN_VARIABLE_LIMIT || limit > AssignmentEnumerator.MAX_VARIABLE_LIMIT) {
                throw new IllegalArgumentException("Limite variabili deve essere tra " + MIN_VARIABLE_LIMIT
                        + " e " + AssignmentEnumerator.MAX_VARIABLE_LIMIT + ", ricevuto: " + limit);
            }
            return limit;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateOutputFile(String filePath) {
            File file = new File(filePath);
            if (file.isDirectory()) {
                throw new IllegalArgumentException("Percorso di output è una directory: " + filePath);
            }

            File parent = file.getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists()) {
                System.out.println("Creazione directory output: " + parent);
                if (!parent.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + parent);
                }
            }
        }
    }

    //endregion
}
