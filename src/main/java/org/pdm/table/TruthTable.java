package org.pdm.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabella di verità completa: intestazioni degli atomi, colonne formula e righe.
 */
public final class TruthTable {

    private final List<String> atoms;
    private final List<String> columns;
    private final List<TruthTableRow> rows;

    TruthTable(List<String> atoms, List<String> columns, List<TruthTableRow> rows) {
        this.atoms = List.copyOf(atoms);
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    /** Atomi in ordine di prima apparizione. */
    public List<String> getAtoms() {
        return atoms;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /** Righe in cui la colonna indicata è vera. */
    public List<TruthTableRow> satisfyingRows(String column) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Colonna inesistente: " + column);
        }
        List<TruthTableRow> result = new ArrayList<>();
        for (TruthTableRow row : rows) {
            if (row.getValue(column)) {
                result.add(row);
            }
        }
        return result;
    }
}
