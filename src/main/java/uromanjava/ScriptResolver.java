package uromanjava;

import java.lang.Character.UnicodeScript;
import java.util.*;
import java.util.logging.Level;

/**
 * Chooses the rule sets that apply to one line, most specific first:
 * explicit language rule set (followed by its parent), then script rule sets
 * in order of first appearance of their script, then the generic rule set.
 *
 * <p>Resolution is a pure lookup against the read-only {@link RuleStore}.</p>
 */
public final class ScriptResolver {
    private final RuleStore store;
    private final boolean strict;

    /**
     * @param store  the rule store
     * @param strict {@code true} to reject language codes missing from the registry
     */
    public ScriptResolver(RuleStore store, boolean strict) {
        this.store = Objects.requireNonNull(store, "store");
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Normalizes a language code and, in strict mode, checks it against the registry.
     *
     * @param lcode optional language code (may be {@code null} or blank)
     * @return the normalized code, or {@code null} if none was given
     * @throws UnknownLanguageCodeException in strict mode, if the code is not registered
     */
    public String checkLanguageCode(String lcode) {
        String code = LanguageRegistry.normalize(lcode);
        if (code != null && strict && !store.getLanguages().isKnown(code)) {
            throw new UnknownLanguageCodeException(code);
        }
        return code;
    }

    /**
     * Resolves the rule sets for a line.
     *
     * @param lcode optional language code (may be {@code null} or blank)
     * @param line  the input line
     * @return rule sets in priority order; never empty, always ending with the generic set
     * @throws UnknownLanguageCodeException in strict mode, if the code is not registered
     */
    public List<RuleSet> resolve(String lcode, String line) {
        final String code = checkLanguageCode(lcode);

        Set<RuleSet> ordered = new LinkedHashSet<>();
        if (code != null) {
            RuleSet lang = store.languageRuleSet(code);
            if (lang != null) {
                ordered.add(lang);
                RuleSet parent = store.getRuleSet(lang.getParent());
                if (parent != null) ordered.add(parent);
            } else {
                Uroman.LOGGER.log(Level.FINE, "No rule set for language code ''{0}'', using script detection", code);
            }
        }

        for (UnicodeScript script : detectScripts(line)) {
            ordered.addAll(store.scriptRuleSets(script));
        }
        ordered.add(store.getGeneric());
        return new ArrayList<>(ordered);
    }

    /**
     * Lists the scripts of a line in order of first appearance,
     * skipping {@code COMMON}, {@code INHERITED} and {@code UNKNOWN}.
     *
     * @param line the input line
     * @return distinct scripts, in encounter order
     */
    public static List<UnicodeScript> detectScripts(String line) {
        Set<UnicodeScript> seen = EnumSet.noneOf(UnicodeScript.class);
        List<UnicodeScript> out = new ArrayList<>(2);
        for (int i = 0; i < line.length(); ) {
            int cp = line.codePointAt(i);
            i += Character.charCount(cp);
            UnicodeScript s = UnicodeScript.of(cp);
            if (s == UnicodeScript.COMMON || s == UnicodeScript.INHERITED || s == UnicodeScript.UNKNOWN) continue;
            if (seen.add(s)) out.add(s);
        }
        return out;
    }
}
