package org.pdm.parser;

import org.pdm.LogicException;

/**
 * Errore di sintassi in una formula, con la posizione (offset di carattere)
 * in cui è stato rilevato. Nessun albero parziale viene restituito.
 */
public abstract class FormulaSyntaxException extends LogicException {

    private final int position;

    protected FormulaSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
