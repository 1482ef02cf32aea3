package org.pdm.table;

import org.pdm.LogicException;

/**
 * La tabella richiesta supera il numero massimo di atomi configurato.
 */
public class TooManyAtomsException extends LogicException {

    private final int atomCount;
    private final int limit;

    public TooManyAtomsException(int atomCount, int limit) {
        super(String.format("Troppi atomi per una tabella completa: %d (massimo %d, righe richieste 2^%d)",
                atomCount, limit, atomCount));
        this.atomCount = atomCount;
        this.limit = limit;
    }

    public int getAtomCount() {
        return atomCount;
    }

    public int getLimit() {
        return limit;
    }
}
