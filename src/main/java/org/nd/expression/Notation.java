package org.nd.expression;

/**
 * Glifi usati nella stampa delle formule.
 *
 * Entrambe le notazioni sono riconosciute dal parser, quindi la stampa in
 * qualunque notazione è sempre rileggibile.
 */
public enum Notation {
    ASCII("~", "^", "v", "->"),
    UNICODE("¬", "∧", "∨", "→");

    private final String not;
    private final String and;
    private final String or;
    private final String implies;

    Notation(String not, String and, String or, String implies) {
        this.not = not;
        this.and = and;
        this.or = or;
        this.implies = implies;
    }

    /**
     * Restituisce il glifo del connettivo o della costante richiesta.
     *
     * @param type variante di nodo (gli atomi non hanno glifo)
     * @return glifo nella notazione corrente
     * @throws IllegalArgumentException per {@link Expression.Type#ATOM}
     */
    public String symbol(Expression.Type type) {
        return switch (type) {
            case NOT -> not;
            case AND -> and;
            case OR -> or;
            case IMPLIES -> implies;
            case BOTTOM -> Bottom.SYMBOL;
            case ATOM -> throw new IllegalArgumentException("Gli atomi non hanno un simbolo di notazione");
        };
    }
}
