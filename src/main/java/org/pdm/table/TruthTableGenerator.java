package org.pdm.table;

import org.pdm.formula.Formula;
import org.pdm.formula.UnboundAtomException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * GENERATORE TABELLE DI VERITÀ - Enumerazione esaustiva degli assegnamenti
 *
 * Per n atomi produce esattamente 2^n righe. Gli atomi sono i bit di un contatore
 * da 0 a 2^n - 1: il primo atomo è il bit più significativo e il bit 1 vale vero,
 * quindi la prima riga ha tutti gli atomi falsi e l'ultima tutti veri.
 *
 * LIMITI:
 * • Il numero massimo di atomi è configurabile (default 16)
 * • {@link #countAtoms(Formula)} espone n prima della generazione, così il chiamante
 *   può decidere se procedere
 * • Oltre il limite la generazione fallisce con {@link TooManyAtomsException}
 *
 * Il generatore non ha stato mutabile ed è quindi rientrante.
 */
public class TruthTableGenerator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    /** Limite predefinito di atomi */
    public static final int DEFAULT_MAX_ATOMS = 16;

    /** Limite assoluto: l'indice di riga deve stare in un int */
    public static final int HARD_MAX_ATOMS = 30;

    private final int maxAtoms;

    public TruthTableGenerator() {
        this(DEFAULT_MAX_ATOMS);
    }

    /**
     * @param maxAtoms numero massimo di atomi accettato, tra 0 e {@value #HARD_MAX_ATOMS}
     * @throws IllegalArgumentException se il limite è fuori intervallo
     */
    public TruthTableGenerator(int maxAtoms) {
        if (maxAtoms < 0 || maxAtoms > HARD_MAX_ATOMS) {
            throw new IllegalArgumentException("Limite atomi fuori intervallo [0, " + HARD_MAX_ATOMS + "]: " + maxAtoms);
        }
        this.maxAtoms = maxAtoms;
    }

    public int getMaxAtoms() {
        return maxAtoms;
    }

    /** Numero di atomi distinti, cioè il logaritmo del numero di righe. */
    public int countAtoms(Formula formula) {
        return formula.atoms().size();
    }

    public boolean exceedsLimit(Formula formula) {
        return countAtoms(formula) > maxAtoms;
    }

    /**
     * Tabella di verità di una singola formula; la colonna prende il testo canonico della formula.
     *
     * @throws TooManyAtomsException se la formula ha più atomi del limite
     */
    public TruthTable generate(Formula formula) {
        Objects.requireNonNull(formula, "formula");
        return generate(List.of(NamedFormula.of(formula)), null, null);
    }

    /**
     * Tabella di verità con più colonne formula.
     *
     * @param columns colonne da valutare per ogni assegnamento (almeno una)
     * @param atoms intestazioni esplicite (duplicati rimossi mantenendo l'ordine), oppure
     *              null per usare gli atomi delle colonne in ordine di prima apparizione
     * @param filter se non null, conserva solo le righe in cui la formula è vera
     * @throws TooManyAtomsException se gli atomi superano il limite
     * @throws UnboundAtomException se le intestazioni esplicite non coprono gli atomi delle colonne
     */
    public TruthTable generate(List<NamedFormula> columns, List<String> atoms, Formula filter) {
        Objects.requireNonNull(columns, "columns");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Serve almeno una colonna formula");
        }

        List<String> header = resolveAtoms(columns, atoms, filter);
        int n = header.size();
        if (n > maxAtoms) {
            throw new TooManyAtomsException(n, maxAtoms);
        }

        List<String> columnNames = new ArrayList<>();
        for (NamedFormula column : columns) {
            if (columnNames.contains(column.name())) {
                throw new IllegalArgumentException("Colonna duplicata: " + column.name());
            }
            columnNames.add(column.name());
        }

        int rowTotal = 1 << n;
        LOGGER.fine(() -> String.format("Generazione tabella: %d atomi, %d righe", n, rowTotal));

        List<TruthTableRow> rows = new ArrayList<>();
        for (int index = 0; index < rowTotal; index++) {
            Map<String, Boolean> assignment = assignmentFor(header, index);
            if (filter != null && !filter.evaluate(assignment)) {
                continue;
            }
            Map<String, Boolean> values = new LinkedHashMap<>();
            for (NamedFormula column : columns) {
                values.put(column.name(), column.formula().evaluate(assignment));
            }
            rows.add(new TruthTableRow(index, assignment, values));
        }

        return new TruthTable(header, columnNames, rows);
    }

    private static List<String> resolveAtoms(List<NamedFormula> columns, List<String> atoms, Formula filter) {
        Set<String> required = new LinkedHashSet<>();
        for (NamedFormula column : columns) {
            required.addAll(column.formula().atoms());
        }
        if (filter != null) {
            required.addAll(filter.atoms());
        }
        if (atoms == null) {
            return new ArrayList<>(required);
        }

        Set<String> explicit = new LinkedHashSet<>(atoms);
        for (String atom : required) {
            if (!explicit.contains(atom)) {
                throw new UnboundAtomException(atom);
            }
        }
        return new ArrayList<>(explicit);
    }

    /**
     * Assegnamento corrispondente a un valore del contatore: il primo atomo è il bit più significativo.
     */
    static Map<String, Boolean> assignmentFor(List<String> header, int index) {
        int n = header.size();
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int position = 0; position < n; position++) {
            int bit = n - 1 - position;
            assignment.put(header.get(position), ((index >> bit) & 1) == 1);
        }
        return assignment;
    }
}
