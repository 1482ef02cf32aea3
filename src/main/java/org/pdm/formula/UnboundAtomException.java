package org.pdm.formula;

import org.pdm.LogicException;

/**
 * Sollevata dalla valutazione stretta quando la formula usa un atomo assente
 * dall'assegnamento fornito.
 */
public class UnboundAtomException extends LogicException {

    private final String atom;

    public UnboundAtomException(String atom) {
        super("Atomo non assegnato: " + atom);
        this.atom = atom;
    }

    public String getAtom() {
        return atom;
    }
}
