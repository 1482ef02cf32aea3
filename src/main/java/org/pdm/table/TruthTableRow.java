package org.pdm.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Riga di una tabella di verità: fotografia dell'assegnamento e valore di ogni colonna.
 * L'indice è il valore del contatore binario che ha generato l'assegnamento.
 */
public final class TruthTableRow {

    private final int index;
    private final Map<String, Boolean> assignment;
    private final Map<String, Boolean> values;

    TruthTableRow(int index, Map<String, Boolean> assignment, Map<String, Boolean> values) {
        this.index = index;
        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int getIndex() {
        return index;
    }

    /** Assegnamento degli atomi, nell'ordine delle intestazioni. */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    /** Valori delle colonne formula, nell'ordine delle colonne. */
    public Map<String, Boolean> getValues() {
        return values;
    }

    /**
     * @return valore della colonna indicata
     * @throws IllegalArgumentException se la colonna non esiste
     */
    public boolean getValue(String column) {
        Boolean value = values.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Colonna inesistente: " + column);
        }
        return value;
    }

    /** Valore della prima colonna, cioè della formula per tabelle a formula singola. */
    public boolean getResult() {
        return values.values().iterator().next();
    }

    public boolean valueOf(String atom) {
        Boolean value = assignment.get(atom);
        if (value == null) {
            throw new IllegalArgumentException("Atomo inesistente: " + atom);
        }
        return value;
    }

    @Override
    public String toString() {
        return assignment + " -> " + values;
    }
}
