package org.pdm.rules;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.pdm.parser.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * CODEC INSIEMI DI REGOLE - Formato di scambio JSON
 *
 * SCHEMA:
 * <pre>
 * { "medical": [ {"id": "R1", "premise": "Fever AND Cough", "conclusion": "Flu", "text": "..."} ],
 *   "loan":    [ ... ] }
 * </pre>
 *
 * In lettura premessa e conclusione vengono analizzate in {@link org.pdm.formula.Formula};
 * in scrittura ogni regola restituisce esattamente i quattro campi stringa letti.
 * Un dominio assente produce una base vuota.
 */
public final class RuleSetCodec {

    private static final Logger LOGGER = Logger.getLogger(RuleSetCodec.class.getName());

    static final String ID = "id";
    static final String PREMISE = "premise";
    static final String CONCLUSION = "conclusion";
    static final String TEXT = "text";
    static final String RULES = "rules";

    private RuleSetCodec() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region LETTURA

    /**
     * Legge tutti i domini del documento, in ordine alfabetico di nome.
     *
     * @throws RuleSetFormatException se il documento non rispetta lo schema
     * @throws DuplicateRuleIdException se un dominio contiene identificatori ripetuti
     */
    public static Map<String, RuleBase> readDomains(String json) {
        JSONObject document = parseDocument(json);
        Map<String, RuleBase> domains = new LinkedHashMap<>();
        for (String domain : new TreeSet<>(document.keySet())) {
            domains.put(domain, readRuleArray(document.get(domain), domain));
        }
        LOGGER.info(() -> "Domini di regole letti: " + domains.keySet());
        return domains;
    }

    /**
     * Legge un singolo dominio; se assente restituisce una base vuota.
     */
    public static RuleBase readDomain(String json, String domain) {
        Objects.requireNonNull(domain, "domain");
        JSONObject document = parseDocument(json);
        if (!document.has(domain)) {
            LOGGER.fine(() -> "Dominio assente, base vuota: " + domain);
            return RuleBase.empty();
        }
        return readRuleArray(document.get(domain), domain);
    }

    private static JSONObject parseDocument(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return new JSONObject(json);
        } catch (JSONException e) {
            throw new RuleSetFormatException("Documento di regole non valido: " + e.getMessage(), e);
        }
    }

    private static RuleBase readRuleArray(Object value, String domain) {
        if (!(value instanceof JSONArray)) {
            throw new RuleSetFormatException("Il dominio '" + domain + "' non contiene una lista di regole");
        }
        JSONArray array = (JSONArray) value;
        List<Rule> rules = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object entry = array.get(i);
            if (!(entry instanceof JSONObject)) {
                throw new RuleSetFormatException(
                        String.format("Dominio '%s', elemento %d: atteso un oggetto regola", domain, i));
            }
            rules.add(readRule((JSONObject) entry));
        }
        return new RuleBase(rules);
    }

    /**
     * Converte un oggetto JSON in regola.
     *
     * @throws RuleSetFormatException per campi mancanti o formule non valide
     */
    public static Rule readRule(JSONObject object) {
        String id = requireString(object, ID, null);
        String premise = requireString(object, PREMISE, id);
        String conclusion = requireString(object, CONCLUSION, id);
        String text = requireString(object, TEXT, id);
        try {
            return Rule.parse(id, premise, conclusion, text);
        } catch (FormulaSyntaxException e) {
            throw new RuleSetFormatException("Regola " + id + ": " + e.getMessage(), e);
        }
    }

    private static String requireString(JSONObject object, String field, String ruleId) {
        Object value = object.opt(field);
        if (!(value instanceof String)) {
            String owner = ruleId != null ? "Regola " + ruleId : "Regola senza id";
            throw new RuleSetFormatException(owner + ": campo stringa '" + field + "' mancante");
        }
        return (String) value;
    }

    //endregion

    //region SCRITTURA

    /** Oggetto JSON con i quattro campi della regola. */
    public static JSONObject toJson(Rule rule) {
        JSONObject object = new JSONObject();
        object.put(ID, rule.getId());
        object.put(PREMISE, rule.getPremiseText());
        object.put(CONCLUSION, rule.getConclusionText());
        object.put(TEXT, rule.getText());
        return object;
    }

    public static JSONArray toJson(Collection<Rule> rules) {
        JSONArray array = new JSONArray();
        for (Rule rule : rules) {
            array.put(toJson(rule));
        }
        return array;
    }

    /** Serializza una base come {"rules": [...]}. */
    public static String write(RuleBase ruleBase) {
        JSONObject document = new JSONObject();
        document.put(RULES, toJson(ruleBase.getRules()));
        return document.toString(2);
    }

    /** Serializza più domini nel formato di scambio. */
    public static String writeDomains(Map<String, RuleBase> domains) {
        JSONObject document = new JSONObject();
        for (Map.Entry<String, RuleBase> entry : domains.entrySet()) {
            document.put(entry.getKey(), toJson(entry.getValue().getRules()));
        }
        return document.toString(2);
    }

    //endregion
}
