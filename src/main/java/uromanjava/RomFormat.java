package uromanjava;

import java.util.*;

/**
 * Output views over a {@link ResolvedOutput}.
 *
 * <p>Each constant is selected by its lowercase name, e.g. {@code "alts"}.</p>
 */
public enum RomFormat {

    /**
     * The best path's edge texts concatenated.
     */
    STR,

    /**
     * The best path as an ordered list of edges.
     */
    EDGES,

    /**
     * The best path's edges, each with its ranked alternates.
     */
    ALTS,

    /**
     * Every edge of the lattice, unfiltered.
     */
    LATTICE;

    /**
     * Returns the default output format.
     *
     * @return {@link #STR}
     */
    public static RomFormat defaultFormat() {
        return STR;
    }

    /**
     * Returns the lowercase string form of this format.
     * <p>
     * Example: {@code ALTS.asStr()} → {@code "alts"}.
     * </p>
     *
     * @return the lowercase string representation
     */
    public String asStr() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a format selector, ignoring case and surrounding whitespace.
     *
     * <pre>{@code
     * RomFormat f1 = RomFormat.fromStr("str");      // STR
     * RomFormat f2 = RomFormat.fromStr("LATTICE");  // LATTICE
     * }</pre>
     *
     * @param value the selector
     * @return the matching format
     * @throws InvalidFormatException if {@code value} is {@code null}, blank or unknown
     */
    public static RomFormat fromStr(String value) {
        RomFormat f = tryParse(value);
        if (f == null) {
            throw new InvalidFormatException(value);
        }
        return f;
    }

    /**
     * Lookup table from lowercase selector to format.
     */
    private static final Map<String, RomFormat> LOOKUP = buildLookup();

    private static Map<String, RomFormat> buildLookup() {
        Map<String, RomFormat> m = new HashMap<>();
        for (RomFormat f : values()) {
            m.put(f.asStr(), f);
        }
        return Collections.unmodifiableMap(m);
    }

    /**
     * Parses a format selector without throwing.
     *
     * @param value the selector; may be {@code null}
     * @return the format, or {@code null} if the input is {@code null}, empty or unknown
     */
    public static RomFormat tryParse(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.isEmpty()) return null;
        return LOOKUP.get(trimmed.toLowerCase(Locale.ROOT));
    }

    private static final List<String> SUPPORTED_NAMES = Collections.unmodifiableList(buildSupportedNames());

    private static List<String> buildSupportedNames() {
        RomFormat[] all = values();
        List<String> out = new ArrayList<>(all.length);
        for (RomFormat f : all) {
            out.add(f.asStr());
        }
        return out;
    }

    /**
     * @return the selectors of all formats in declaration order (read-only)
     */
    public static List<String> supportedNames() {
        return SUPPORTED_NAMES;
    }

    /**
     * @return {@code true} if this view is a list of edges rather than a string
     */
    public boolean isEdgeList() {
        return this != STR;
    }
}
