package org.pdm.formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero finito e aciclico.
 * Ogni nodo ha un {@link Type} che determina quali campi sono significativi:
 * • ATOM: solo il nome della variabile
 * • NOT: solo l'operando
 * • AND, OR, XOR, IMPLIES, IFF: operando sinistro e destro
 *
 * I nodi vengono costruiti una volta dal parser (o dai metodi factory) e non vengono
 * mai modificati: la valutazione è una funzione pura dell'albero e dell'assegnamento.
 *
 * OPERAZIONI:
 * • {@link #atoms()}: atomi distinti in ordine di prima apparizione
 * • {@link #evaluate(Map)}: valutazione stretta, ogni atomo deve essere assegnato
 * • {@link #evaluate(Set)}: valutazione a mondo chiuso, gli atomi assenti sono falsi
 * • {@link #toString()}: testo canonico che il parser ricostruisce nello stesso albero
 */
public final class Formula {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati, con la precedenza usata in stampa.
     * Valori più alti legano più strettamente.
     */
    public enum Type {
        IFF(1, "<->"),
        IMPLIES(2, "->"),
        XOR(3, "XOR"),
        OR(4, "OR"),
        AND(5, "AND"),
        NOT(6, "NOT"),
        ATOM(7, null);

        private final int precedence;
        private final String symbol;

        Type(int precedence, String symbol) {
            this.precedence = precedence;
            this.symbol = symbol;
        }

        public int precedence() {
            return precedence;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isBinary() {
            return this != ATOM && this != NOT;
        }
    }

    private static final Pattern ATOM_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> KEYWORDS = Set.of("NOT", "AND", "OR", "XOR");

    /** Tipo del nodo */
    private final Type type;

    /** Nome dell'atomo (solo ATOM) */
    private final String name;

    /** Operando sinistro, oppure unico operando per NOT */
    private final Formula left;

    /** Operando destro (solo operatori binari) */
    private final Formula right;

    //endregion

    //region COSTRUZIONE

    private Formula(Type type, String name, Formula left, Formula right) {
        this.type = type;
        this.name = name;
        this.left = left;
        this.right = right;
    }

    /**
     * Crea una foglia atomica.
     *
     * @param name identificatore alfanumerico, non una parola chiave
     * @throws IllegalArgumentException se il nome è vuoto, non valido o riservato
     */
    public static Formula atom(String name) {
        if (name == null || !ATOM_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Nome atomo non valido: " + name);
        }
        if (KEYWORDS.contains(name.toUpperCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Il nome atomo coincide con una parola chiave: " + name);
        }
        return new Formula(Type.ATOM, name, null, null);
    }

    public static Formula not(Formula operand) {
        requireOperand(operand, Type.NOT);
        return new Formula(Type.NOT, null, operand, null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Type.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Type.OR, left, right);
    }

    public static Formula xor(Formula left, Formula right) {
        return binary(Type.XOR, left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return binary(Type.IMPLIES, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Type.IFF, left, right);
    }

    /**
     * Costruisce un nodo binario del tipo indicato.
     *
     * @throws IllegalArgumentException se il tipo non è binario o un operando è null
     */
    public static Formula binary(Type type, Formula left, Formula right) {
        if (type == null || !type.isBinary()) {
            throw new IllegalArgumentException("Tipo non binario: " + type);
        }
        requireOperand(left, type);
        requireOperand(right, type);
        return new Formula(type, null, left, right);
    }

    private static void requireOperand(Formula operand, Type type) {
        if (operand == null) {
            throw new IllegalArgumentException("Operando null per operatore " + type);
        }
    }

    //endregion

    //region ACCESSO AI CAMPI

    public Type getType() {
        return type;
    }

    public boolean isAtom() {
        return type == Type.ATOM;
    }

    /**
     * @return nome dell'atomo
     * @throws IllegalStateException se il nodo non è un atomo
     */
    public String getName() {
        if (type != Type.ATOM) {
            throw new IllegalStateException("Il nodo " + type + " non ha un nome");
        }
        return name;
    }

    /**
     * @return operando di una negazione
     * @throws IllegalStateException se il nodo non è una negazione
     */
    public Formula getOperand() {
        if (type != Type.NOT) {
            throw new IllegalStateException("Il nodo " + type + " non è una negazione");
        }
        return left;
    }

    public Formula getLeft() {
        requireBinary();
        return left;
    }

    public Formula getRight() {
        requireBinary();
        return right;
    }

    private void requireBinary() {
        if (!type.isBinary()) {
            throw new IllegalStateException("Il nodo " + type + " non è binario");
        }
    }

    //endregion

    //region ATOMI

    /**
     * Restituisce gli atomi distinti nell'ordine di prima apparizione
     * (visita in profondità da sinistra a destra).
     */
    public Set<String> atoms() {
        Set<String> collected = new LinkedHashSet<>();
        collectAtoms(collected);
        return Collections.unmodifiableSet(collected);
    }

    private void collectAtoms(Set<String> collected) {
        switch (type) {
            case ATOM -> collected.add(name);
            case NOT -> left.collectAtoms(collected);
            default -> {
                left.collectAtoms(collected);
                right.collectAtoms(collected);
            }
        }
    }

    //endregion

    //region VALUTAZIONE

    /**
     * Valuta la formula sotto un assegnamento completo.
     *
     * @param assignment valore di verità per ogni atomo della formula
     * @return valore di verità della formula
     * @throws UnboundAtomException se un atomo della formula non è assegnato
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        Objects.requireNonNull(assignment, "assignment");
        return evaluateWith(atom -> {
            Boolean value = assignment.get(atom);
            if (value == null) {
                throw new UnboundAtomException(atom);
            }
            return value;
        });
    }

    /**
     * Valuta la formula con assunzione di mondo chiuso: sono veri solo gli atomi
     * contenuti nell'insieme, tutti gli altri sono falsi.
     *
     * @param trueAtoms atomi noti come veri
     * @return valore di verità della formula
     */
    public boolean evaluate(Set<String> trueAtoms) {
        Objects.requireNonNull(trueAtoms, "trueAtoms");
        return evaluateWith(trueAtoms::contains);
    }

    private boolean evaluateWith(Function<String, Boolean> valuation) {
        return switch (type) {
            case ATOM -> valuation.apply(name);
            case NOT -> !left.evaluateWith(valuation);
            case AND -> left.evaluateWith(valuation) & right.evaluateWith(valuation);
            case OR -> left.evaluateWith(valuation) | right.evaluateWith(valuation);
            case XOR -> left.evaluateWith(valuation) != right.evaluateWith(valuation);
            case IMPLIES -> !left.evaluateWith(valuation) | right.evaluateWith(valuation);
            case IFF -> left.evaluateWith(valuation) == right.evaluateWith(valuation);
        };
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE E UGUAGLIANZA

    /**
     * Testo canonico con parole chiave e parentesi minime.
     * Il parser ricostruisce da questo testo un albero strutturalmente uguale.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb);
        return sb.toString();
    }

    private void render(StringBuilder sb) {
        switch (type) {
            case ATOM -> sb.append(name);
            case NOT -> {
                sb.append("NOT ");
                renderChild(sb, left, left.type.isBinary());
            }
            default -> {
                // Associatività a sinistra: a destra serve la parentesi anche a parità di precedenza
                renderChild(sb, left, left.type.precedence < type.precedence);
                sb.append(' ').append(type.symbol).append(' ');
                renderChild(sb, right, right.type.precedence <= type.precedence);
            }
        }
    }

    private static void renderChild(StringBuilder sb, Formula child, boolean parenthesize) {
        if (parenthesize) {
            sb.append('(');
            child.render(sb);
            sb.append(')');
        } else {
            child.render(sb);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        Formula other = (Formula) o;
        return type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, left, right);
    }

    //endregion
}
