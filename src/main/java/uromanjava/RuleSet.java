package uromanjava;

import java.lang.Character.UnicodeScript;
import java.util.*;

/**
 * An ordered, read-only collection of rules for one language or script.
 *
 * <p>Rule sets are created once while the {@link RuleStore} loads and are
 * shared by every romanization call afterwards. Lookups are by exact source
 * string, pre-filtered by a {@link StarterUnion}.</p>
 */
public final class RuleSet {

    /**
     * The level a rule set operates at.
     */
    public enum Kind {
        /**
         * Keyed by an ISO 639-3 language code, selected only explicitly.
         */
        LANGUAGE,
        /**
         * Keyed by a script identifier, selected when its script occurs in a line.
         */
        SCRIPT,
        /**
         * The script-independent fallback rule set, always selected last.
         */
        GENERIC;

        /**
         * Parses a kind name, case-insensitively.
         *
         * @param value e.g. {@code "script"}
         * @return the kind
         * @throws IllegalArgumentException if the value is unknown
         */
        public static Kind fromStr(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Rule set kind cannot be null");
            }
            return Kind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final String id;
    private final Kind kind;
    private final Set<UnicodeScript> scripts;
    private final String parent;
    private final List<Rule> rules;
    private final Map<String, List<Rule>> bySource;
    private final int maxLength;
    private final StarterUnion union;

    /**
     * Creates a rule set.
     *
     * @param id      unique id (language code or script identifier)
     * @param kind    rule set kind
     * @param scripts scripts this set serves (used by script detection)
     * @param parent  id of a rule set placed directly after this one, or {@code null}
     * @param rules   rules in registration order
     */
    public RuleSet(String id, Kind kind, Collection<UnicodeScript> scripts, String parent, List<Rule> rules) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.scripts = scripts.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(scripts));
        this.parent = parent;
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));

        Map<String, List<Rule>> index = new HashMap<>();
        int max = 0;
        for (Rule r : this.rules) {
            index.computeIfAbsent(r.getSource(), k -> new ArrayList<>(1)).add(r);
            max = Math.max(max, r.getSourceLength());
        }
        for (Map.Entry<String, List<Rule>> e : index.entrySet()) {
            e.setValue(Collections.unmodifiableList(e.getValue()));
        }
        this.bySource = index;
        this.maxLength = max;
        this.union = StarterUnion.build(this.rules);
    }

    public String getId() {
        return id;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the scripts this rule set serves (read-only)
     */
    public Set<UnicodeScript> getScripts() {
        return scripts;
    }

    /**
     * @return id of the rule set to try right after this one, or {@code null}
     */
    public String getParent() {
        return parent;
    }

    /**
     * @return all rules in registration order (read-only)
     */
    public List<Rule> getRules() {
        return rules;
    }

    /**
     * Returns the rules whose source is exactly {@code source}.
     *
     * @param source a candidate span
     * @return matching rules in registration order, possibly empty
     */
    public List<Rule> lookup(String source) {
        List<Rule> hit = bySource.get(source);
        return hit != null ? hit : Collections.emptyList();
    }

    /**
     * Collects every rule whose source and context match at {@code start}.
     *
     * @param lattice the lattice holding the line
     * @param start   code-point offset to match at
     * @param out     receives matching rules; ordered by registration order on return
     */
    void collectMatches(Lattice lattice, int start, List<Rule> out) {
        final int cp = lattice.codePointAt(start);
        if (!union.hasStarter(cp)) return;

        final int before = out.size();
        final int tryMax = Math.min(maxLength, lattice.length() - start);
        for (int len = 1; len <= tryMax; len++) {
            if (!union.mayMatch(cp, len)) continue;
            final int end = start + len;
            for (Rule r : lookup(lattice.substring(start, end))) {
                if (r.contextMatches(lattice, start, end)) out.add(r);
            }
        }
        if (out.size() - before > 1) {
            out.subList(before, out.size()).sort(Comparator.comparingInt(Rule::getOrder));
        }
    }

    @Override
    public String toString() {
        return "<RuleSet " + id + " (" + kind.name().toLowerCase(Locale.ROOT) + ") with " + rules.size() + " rules>";
    }
}
