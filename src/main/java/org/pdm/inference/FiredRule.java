package org.pdm.inference;

import java.util.List;
import java.util.Objects;

/**
 * Voce della traccia del forward chaining: una regola che in un passaggio ha aggiunto
 * almeno un fatto nuovo.
 *
 * @param step numero progressivo globale (da 1)
 * @param pass passaggio sulla base di regole in cui la regola è scattata (da 1)
 * @param ruleId identificatore della regola
 * @param addedAtoms atomi aggiunti, nell'ordine della conclusione
 * @param explanation spiegazione leggibile
 */
public record FiredRule(int step, int pass, String ruleId, List<String> addedAtoms, String explanation) {

    public FiredRule {
        Objects.requireNonNull(ruleId, "ruleId");
        addedAtoms = List.copyOf(addedAtoms);
    }
}
