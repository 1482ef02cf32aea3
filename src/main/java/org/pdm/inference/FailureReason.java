package org.pdm.inference;

/**
 * Motivo per cui un obiettivo del backward chaining non è stato dimostrato.
 */
public enum FailureReason {
    CYCLE("cycle", "Dipendenza circolare: l'obiettivo è già in corso di dimostrazione."),
    NO_APPLICABLE_RULE("no applicable rule", "Nessuna regola conclude questo obiettivo."),
    PREMISE_FALSE("premise false", "Le premesse di tutte le regole applicabili sono false.");

    private final String code;
    private final String description;

    FailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    /** Codice stabile, adatto al confronto programmatico. */
    public String code() {
        return code;
    }

    public String description() {
        return description;
    }
}
