package org.pdm.parser;

/**
 * Violazione della grammatica: token inatteso, parentesi non bilanciate,
 * token residui dopo una formula completa o formula vuota.
 */
public class FormulaParseException extends FormulaSyntaxException {

    private final String expected;
    private final String found;

    public FormulaParseException(int position, String expected, String found) {
        super(String.format("Atteso %s ma trovato '%s' in posizione %d", expected, found, position), position);
        this.expected = expected;
        this.found = found;
    }

    /** Insieme leggibile dei token accettabili nel punto dell'errore. */
    public String getExpected() {
        return expected;
    }

    /** Testo del token trovato, oppure {@code END} a fine input. */
    public String getFound() {
        return found;
    }
}
