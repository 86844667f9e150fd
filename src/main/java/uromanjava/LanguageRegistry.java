package uromanjava;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Known ISO 639-3 language codes with their English names
 * ({@code languages.tsv}: {@code code<TAB>name} per line).
 *
 * <p>Used for strict language-code validation and for listing languages.
 * Immutable once constructed.</p>
 */
public final class LanguageRegistry {
    /**
     * Registry file name inside a rule directory.
     */
    public static final String FILE_NAME = "languages.tsv";

    private static final Pattern ISO_639_3 = Pattern.compile("[a-z]{3}");

    private final Map<String, String> names;

    /**
     * Creates a registry.
     *
     * @param names code → English name, in listing order
     * @throws IllegalArgumentException if a code is not three lowercase letters
     */
    public LanguageRegistry(Map<String, String> names) {
        for (String code : names.keySet()) {
            if (!isWellFormed(code)) {
                throw new IllegalArgumentException("Not an ISO 639-3 code: " + code);
            }
        }
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    /**
     * @return an empty registry
     */
    public static LanguageRegistry empty() {
        return new LanguageRegistry(Collections.emptyMap());
    }

    /**
     * Tests the shape of a code: exactly three lowercase ASCII letters.
     *
     * @param code a normalized code
     * @return {@code true} if well-formed
     */
    public static boolean isWellFormed(String code) {
        return code != null && ISO_639_3.matcher(code).matches();
    }

    /**
     * Normalizes a user-supplied code: trimmed and lower-cased.
     *
     * @param code the raw code, may be {@code null}
     * @return the normalized code, or {@code null} if absent or blank
     */
    public static String normalize(String code) {
        if (code == null) return null;
        String c = code.trim().toLowerCase(Locale.ROOT);
        return c.isEmpty() ? null : c;
    }

    /**
     * @param code a normalized code
     * @return {@code true} if the code is registered
     */
    public boolean isKnown(String code) {
        return code != null && names.containsKey(code);
    }

    /**
     * @param code a normalized code
     * @return the English name, or {@code null} if unknown
     */
    public String nameOf(String code) {
        return names.get(code);
    }

    /**
     * @return code → name in listing order (read-only)
     */
    public Map<String, String> asMap() {
        return names;
    }

    public int size() {
        return names.size();
    }

    /**
     * Parses {@code languages.tsv} content.
     *
     * @param br   reader over the file
     * @param name file name used in error messages
     * @return the registry
     * @throws IOException       if reading fails
     * @throws RuleLoadException if a line is malformed or a code repeats
     */
    static LanguageRegistry parse(BufferedReader br, String name) throws IOException {
        Map<String, String> m = new LinkedHashMap<>();
        int lineNo = 0;
        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = raw.trim();
            if (lineNo == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1);
            }
            if (line.isEmpty() || line.startsWith("#")) continue;

            int tab = line.indexOf('\t');
            if (tab < 0) {
                throw RuleLoadException.atLine(name, lineNo, "missing TAB", raw);
            }
            String code = line.substring(0, tab).trim();
            String lang = line.substring(tab + 1).trim();
            if (!isWellFormed(code)) {
                throw RuleLoadException.atLine(name, lineNo, "not an ISO 639-3 code", raw);
            }
            if (m.put(code, lang) != null) {
                throw RuleLoadException.atLine(name, lineNo, "duplicate code", raw);
            }
        }
        return new LanguageRegistry(m);
    }
}
