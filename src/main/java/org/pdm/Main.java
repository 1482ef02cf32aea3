package org.pdm;

import org.pdm.formula.Formula;
import org.pdm.inference.BackwardChainResult;
import org.pdm.inference.Contradiction;
import org.pdm.inference.FiredRule;
import org.pdm.inference.ForwardChainResult;
import org.pdm.rules.RuleBase;
import org.pdm.rules.RuleSetCodec;
import org.pdm.table.TruthTable;
import org.pdm.table.TruthTableGenerator;
import org.pdm.table.TruthTableRow;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PROPOSITIONAL DECISION MAKER - Interfaccia a riga di comando
 *
 * MODALITÀ OPERATIVE:
 * - Tabella di verità (-table "formula"): enumerazione di tutti gli assegnamenti
 * - Valutazione (-eval "formula" -assign A=true,B=false): singolo assegnamento completo
 * - Forward chaining (-rules file.json -domain nome -facts A,B -forward)
 * - Backward chaining (-rules file.json -domain nome -facts A,B -goal X)
 *
 * Il limite di atomi per le tabelle è configurabile con -max-atoms (default 16).
 * Codici di uscita: 0 successo, 1 errore di elaborazione, 2 parametri non validi.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String TABLE_PARAM = "-table";
    private static final String EVAL_PARAM = "-eval";
    private static final String ASSIGN_PARAM = "-assign";
    private static final String RULES_PARAM = "-rules";
    private static final String DOMAIN_PARAM = "-domain";
    private static final String FACTS_PARAM = "-facts";
    private static final String FORWARD_PARAM = "-forward";
    private static final String GOAL_PARAM = "-goal";
    private static final String MAX_ATOMS_PARAM = "-max-atoms";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String DEFAULT_DOMAIN = "medical";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue un comando completo scrivendo l'output sul flusso indicato.
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output
     * @return codice di uscita
     */
    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_USAGE;
        }

        EngineConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return EXIT_USAGE;
        }
        if (config == null) {
            printApplicationHelp(out);
            return EXIT_OK;
        }

        try {
            LogicEngine engine = new LogicEngine(config.maxAtoms);
            switch (config.mode) {
                case TABLE -> printTruthTable(engine, config, out);
                case EVAL -> printEvaluation(engine, config, out);
                case FORWARD -> printForwardChain(engine, loadRules(config), config, out);
                case BACKWARD -> printBackwardChain(engine, loadRules(config), config, out);
            }
            return EXIT_OK;
        } catch (LogicException | IOException e) {
            LOGGER.log(Level.FINE, "Elaborazione fallita", e);
            out.println("[E] " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    //endregion

    //region ESECUZIONE MODALITÀ

    private static void printTruthTable(LogicEngine engine, EngineConfiguration config, PrintStream out) {
        Formula formula = engine.parse(config.formulaText);
        int atomCount = engine.countAtoms(formula);
        if (engine.getTableGenerator().exceedsLimit(formula)) {
            out.println("[W] Troppi atomi (" + atomCount + ") per la tabella completa.");
        }
        TruthTable table = engine.generateTable(formula);

        out.println(String.join(" | ", table.getAtoms()) + (atomCount > 0 ? " | " : "") + formula);
        for (TruthTableRow row : table.getRows()) {
            StringBuilder line = new StringBuilder();
            for (boolean value : row.getAssignment().values()) {
                line.append(value ? 'T' : 'F').append(" | ");
            }
            out.println(line.append(row.getResult() ? 'T' : 'F'));
        }
        out.println("[I] Righe: " + table.rowCount() + " (2^" + atomCount + ")");
    }

    private static void printEvaluation(LogicEngine engine, EngineConfiguration config, PrintStream out) {
        Formula formula = engine.parse(config.formulaText);
        boolean value = engine.evaluate(formula, config.assignment);
        out.println("[I] " + formula + " = " + value);
    }

    private static void printForwardChain(LogicEngine engine, RuleBase rules, EngineConfiguration config,
                                          PrintStream out) {
        ForwardChainResult result = engine.forwardChain(rules, config.facts);
        for (FiredRule fired : result.getTrace()) {
            out.println("[I] " + fired.explanation());
        }
        for (Contradiction contradiction : result.getContradictions()) {
            out.println("[W] Contraddizione su " + contradiction.atom() + ": " + contradiction.message());
        }
        out.println("[I] Fatti finali: " + String.join(", ", result.getFinalFacts()));
    }

    private static void printBackwardChain(LogicEngine engine, RuleBase rules, EngineConfiguration config,
                                           PrintStream out) {
        BackwardChainResult result = engine.backwardChain(rules, config.facts, config.goal);
        out.print(result.proof().render());
        out.println("[I] Obiettivo " + result.goal() + (result.proved() ? " dimostrato" : " non dimostrato"));
    }

    private static RuleBase loadRules(EngineConfiguration config) throws IOException {
        String json = Files.readString(config.rulesPath, StandardCharsets.UTF_8);
        RuleBase rules = RuleSetCodec.readDomain(json, config.domain);
        LOGGER.info(() -> "Regole caricate per il dominio " + config.domain + ": " + rules.size());
        return rules;
    }

    private static void printApplicationHelp(PrintStream out) {
        out.println("Uso:");
        out.println("  -table <formula>                       tabella di verità");
        out.println("  -eval <formula> -assign A=true,B=false valutazione con assegnamento completo");
        out.println("  -rules <file.json> [-domain <nome>] [-facts A,B] -forward");
        out.println("  -rules <file.json> [-domain <nome>] [-facts A,B] -goal <atomo>");
        out.println("  -max-atoms <n>                         limite atomi per le tabelle (default 16)");
        out.println("  -h                                     questo messaggio");
        out.println("Operatori: NOT ~, AND &, OR |, XOR, ->, <->, parentesi.");
    }

    //endregion

    //region CONFIGURAZIONE E PARSING PARAMETRI

    private enum Mode { TABLE, EVAL, FORWARD, BACKWARD }

    /**
     * Configurazione immutabile di un'esecuzione.
     */
    static final class EngineConfiguration {
        final Mode mode;
        final String formulaText;
        final Map<String, Boolean> assignment;
        final Path rulesPath;
        final String domain;
        final Set<String> facts;
        final String goal;
        final int maxAtoms;

        EngineConfiguration(Mode mode, String formulaText, Map<String, Boolean> assignment, Path rulesPath,
                            String domain, Set<String> facts, String goal, int maxAtoms) {
            this.mode = mode;
            this.formulaText = formulaText;
            this.assignment = assignment;
            this.rulesPath = rulesPath;
            this.domain = domain;
            this.facts = facts;
            this.goal = goal;
            this.maxAtoms = maxAtoms;
        }
    }

    /**
     * Parser dei parametri con validazione e messaggi di errore per l'utente.
     */
    static final class ArgumentParser {

        /**
         * @return configurazione validata, oppure null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri sono incompleti o in conflitto
         */
        EngineConfiguration parse(String[] args) {
            Mode mode = null;
            String formulaText = null;
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            Path rulesPath = null;
            String domain = DEFAULT_DOMAIN;
            Set<String> facts = new LinkedHashSet<>();
            String goal = null;
            int maxAtoms = TruthTableGenerator.DEFAULT_MAX_ATOMS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case TABLE_PARAM -> {
                        mode = exclusiveMode(mode, Mode.TABLE);
                        formulaText = nextArgument(args, ++i, "formula");
                    }
                    case EVAL_PARAM -> {
                        mode = exclusiveMode(mode, Mode.EVAL);
                        formulaText = nextArgument(args, ++i, "formula");
                    }
                    case ASSIGN_PARAM -> assignment.putAll(parseAssignment(nextArgument(args, ++i, "assegnamento")));
                    case RULES_PARAM -> rulesPath = Path.of(nextArgument(args, ++i, "file regole"));
                    case DOMAIN_PARAM -> domain = nextArgument(args, ++i, "dominio");
                    case FACTS_PARAM -> facts.addAll(splitList(nextArgument(args, ++i, "fatti")));
                    case FORWARD_PARAM -> mode = exclusiveMode(mode, Mode.FORWARD);
                    case GOAL_PARAM -> {
                        mode = exclusiveMode(mode, Mode.BACKWARD);
                        goal = nextArgument(args, ++i, "obiettivo");
                    }
                    case MAX_ATOMS_PARAM -> maxAtoms = parseMaxAtoms(nextArgument(args, ++i, "limite atomi"));
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una modalità: -table, -eval, -forward o -goal");
            }
            if ((mode == Mode.FORWARD || mode == Mode.BACKWARD) && rulesPath == null) {
                throw new IllegalArgumentException("La modalità richiede il file di regole (-rules)");
            }
            if (rulesPath != null && !Files.isReadable(rulesPath)) {
                throw new IllegalArgumentException("File regole non leggibile: " + rulesPath);
            }
            return new EngineConfiguration(mode, formulaText, assignment, rulesPath, domain, facts, goal, maxAtoms);
        }

        private static Mode exclusiveMode(Mode current, Mode requested) {
            if (current != null && current != requested) {
                throw new IllegalArgumentException("Modalità in conflitto: " + current + " e " + requested);
            }
            return requested;
        }

        private static String nextArgument(String[] args, int index, String what) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + what);
            }
            return args[index];
        }

        private static Set<String> splitList(String value) {
            Set<String> items = new LinkedHashSet<>();
            for (String item : value.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
            return items;
        }

        private static Map<String, Boolean> parseAssignment(String value) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (String pair : splitList(value)) {
                String[] parts = pair.split("=", 2);
                if (parts.length != 2) {
                    throw new IllegalArgumentException("Assegnamento non valido (atteso ATOMO=true|false): " + pair);
                }
                String literal = parts[1].trim().toLowerCase(Locale.ROOT);
                if (!literal.equals("true") && !literal.equals("false")) {
                    throw new IllegalArgumentException("Valore di verità non valido: " + parts[1]);
                }
                assignment.put(parts[0].trim(), Boolean.parseBoolean(literal));
            }
            return assignment;
        }

        private static int parseMaxAtoms(String value) {
            try {
                int maxAtoms = Integer.parseInt(value);
                if (maxAtoms < 0 || maxAtoms > TruthTableGenerator.HARD_MAX_ATOMS) {
                    throw new IllegalArgumentException("Limite atomi fuori intervallo: " + value);
                }
                return maxAtoms;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Limite atomi non numerico: " + value, e);
            }
        }
    }

    //endregion
}
