package org.pdm;

import org.pdm.formula.Formula;
import org.pdm.inference.BackwardChainResult;
import org.pdm.inference.BackwardChainer;
import org.pdm.inference.ForwardChainResult;
import org.pdm.inference.ForwardChainer;
import org.pdm.parser.FormulaLexer;
import org.pdm.parser.FormulaParser;
import org.pdm.parser.Token;
import org.pdm.rules.RuleBase;
import org.pdm.table.TruthTable;
import org.pdm.table.TruthTableGenerator;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * MOTORE LOGICO - Punto di accesso unico alle interrogazioni
 *
 * Espone le operazioni usate dai livelli di presentazione: tokenize, parse, evaluate,
 * generateTable, forwardChain, backwardChain. Ogni metodo riceve input espliciti e
 * restituisce un risultato o un'eccezione tipizzata; non esiste stato di sessione,
 * quindi la stessa istanza può servire chiamate concorrenti indipendenti.
 *
 * L'unico parametro di configurazione è il limite di atomi per le tabelle di verità.
 */
public class LogicEngine {

    private final TruthTableGenerator tableGenerator;
    private final ForwardChainer forwardChainer = new ForwardChainer();
    private final BackwardChainer backwardChainer = new BackwardChainer();

    public LogicEngine() {
        this(TruthTableGenerator.DEFAULT_MAX_ATOMS);
    }

    /**
     * @param maxTableAtoms numero massimo di atomi per {@link #generateTable(Formula)}
     */
    public LogicEngine(int maxTableAtoms) {
        this.tableGenerator = new TruthTableGenerator(maxTableAtoms);
    }

    public List<Token> tokenize(String text) {
        return FormulaLexer.tokenize(text);
    }

    public Formula parse(String text) {
        return FormulaParser.parse(text);
    }

    public Formula parse(List<Token> tokens) {
        return FormulaParser.parse(tokens);
    }

    /** Valutazione stretta: ogni atomo della formula deve comparire nell'assegnamento. */
    public boolean evaluate(Formula formula, Map<String, Boolean> assignment) {
        return formula.evaluate(assignment);
    }

    /** Numero di atomi della formula, da controllare prima di chiedere la tabella. */
    public int countAtoms(Formula formula) {
        return tableGenerator.countAtoms(formula);
    }

    public TruthTable generateTable(Formula formula) {
        return tableGenerator.generate(formula);
    }

    public TruthTableGenerator getTableGenerator() {
        return tableGenerator;
    }

    public ForwardChainResult forwardChain(RuleBase ruleBase, Set<String> initialFacts) {
        return forwardChainer.forwardChain(ruleBase, initialFacts);
    }

    public BackwardChainResult backwardChain(RuleBase ruleBase, Set<String> facts, String goal) {
        return backwardChainer.backwardChain(ruleBase, facts, goal);
    }
}
