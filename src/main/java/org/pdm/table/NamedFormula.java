package org.pdm.table;

import org.pdm.formula.Formula;

import java.util.Objects;

/**
 * Formula con il nome della colonna che la rappresenta in una tabella di verità.
 */
public record NamedFormula(String name, Formula formula) {

    public NamedFormula {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(formula, "formula");
    }

    /** Colonna che usa come nome il testo canonico della formula. */
    public static NamedFormula of(Formula formula) {
        return new NamedFormula(formula.toString(), formula);
    }
}
