package org.pdm.rules;

import org.pdm.formula.Formula;
import org.pdm.parser.FormulaParser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * REGOLA - Coppia premessa/conclusione con identificatore e descrizione
 *
 * La conclusione è di solito un singolo atomo, ma il modello accetta qualsiasi formula;
 * {@link #getConclusionKind()} indica come i motori di inferenza la trattano.
 *
 * Quando la regola è costruita da testo ({@link #parse}) conserva le stringhe originali
 * di premessa e conclusione, così la serializzazione restituisce esattamente i quattro
 * campi letti. Costruita da alberi, usa il testo canonico delle formule.
 */
public final class Rule {

    private final String id;
    private final Formula premise;
    private final Formula conclusion;
    private final String text;
    private final String premiseText;
    private final String conclusionText;
    private final ConclusionKind conclusionKind;

    public Rule(String id, Formula premise, Formula conclusion, String text) {
        this(id, premise, conclusion, text,
                Objects.requireNonNull(premise, "premise").toString(),
                Objects.requireNonNull(conclusion, "conclusion").toString());
    }

    private Rule(String id, Formula premise, Formula conclusion, String text,
                 String premiseText, String conclusionText) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identificatore di regola null o vuoto");
        }
        this.id = id;
        this.premise = Objects.requireNonNull(premise, "premise");
        this.conclusion = Objects.requireNonNull(conclusion, "conclusion");
        this.text = text != null ? text : "";
        this.premiseText = premiseText;
        this.conclusionText = conclusionText;
        this.conclusionKind = ConclusionKind.classify(conclusion);
    }

    /**
     * Costruisce una regola analizzando premessa e conclusione.
     *
     * @throws org.pdm.parser.FormulaSyntaxException se una delle due formule non è valida
     */
    public static Rule parse(String id, String premise, String conclusion, String text) {
        Objects.requireNonNull(premise, "premise");
        Objects.requireNonNull(conclusion, "conclusion");
        return new Rule(id, FormulaParser.parse(premise), FormulaParser.parse(conclusion), text,
                premise, conclusion);
    }

    public String getId() {
        return id;
    }

    public Formula getPremise() {
        return premise;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    public String getText() {
        return text;
    }

    public String getPremiseText() {
        return premiseText;
    }

    public String getConclusionText() {
        return conclusionText;
    }

    public ConclusionKind getConclusionKind() {
        return conclusionKind;
    }

    /**
     * Letterali asseriti dalla conclusione, da sinistra a destra.
     * Vuoto per conclusioni {@link ConclusionKind#COMPOUND}.
     */
    public List<Literal> conclusionLiterals() {
        if (conclusionKind == ConclusionKind.COMPOUND) {
            return List.of();
        }
        List<Literal> literals = new ArrayList<>();
        collectLiterals(conclusion, literals);
        return Collections.unmodifiableList(literals);
    }

    private static void collectLiterals(Formula formula, List<Literal> literals) {
        switch (formula.getType()) {
            case ATOM -> literals.add(new Literal(formula.getName(), true));
            case NOT -> literals.add(new Literal(formula.getOperand().getName(), false));
            case AND -> {
                collectLiterals(formula.getLeft(), literals);
                collectLiterals(formula.getRight(), literals);
            }
            default -> throw new IllegalStateException("Conclusione non letterale: " + formula);
        }
    }

    /** Vero se la conclusione è esattamente l'atomo indicato. */
    public boolean concludes(String atom) {
        return conclusionKind == ConclusionKind.POSITIVE_ATOM && conclusion.getName().equals(atom);
    }

    @Override
    public String toString() {
        return id + ": " + premiseText + " => " + conclusionText;
    }
}
