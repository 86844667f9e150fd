package uromanjava;

/**
 * Closed set of edge kinds a lattice may contain.
 *
 * <p>Every consumer of {@link Edge} (path selection, projections, JSON output)
 * switches over this enum, so adding a kind means touching all of them.</p>
 */
public enum EdgeType {
    /**
     * Produced by a rule of a language-specific rule set.
     */
    LANG_RULE("lang-rule"),
    /**
     * Produced by a rule of a script-level rule set.
     */
    SCRIPT_RULE("script-rule"),
    /**
     * Produced by a rule of the generic rule set.
     */
    GENERIC_RULE("generic-rule"),
    /**
     * Produced by the {@link NumericRecognizer}.
     */
    NUMERIC("numeric"),
    /**
     * Unmapped whitespace passed through unchanged.
     */
    WHITESPACE("whitespace"),
    /**
     * Unmapped code point passed through unchanged.
     */
    FALLBACK("fallback");

    private final String tag;

    EdgeType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the external tag of this kind (e.g. {@code "script-rule"}).
     *
     * @return the tag used in edge records and JSON output
     */
    public String tag() {
        return tag;
    }

    /**
     * Returns the rule edge kind matching a rule set kind.
     *
     * @param kind the rule set kind
     * @return the edge type for rules of that kind
     */
    public static EdgeType forRuleSet(RuleSet.Kind kind) {
        switch (kind) {
            case LANGUAGE:
                return LANG_RULE;
            case SCRIPT:
                return SCRIPT_RULE;
            case GENERIC:
                return GENERIC_RULE;
            default:
                throw new IllegalArgumentException("Unhandled rule set kind: " + kind);
        }
    }

    @Override
    public String toString() {
        return tag;
    }
}
