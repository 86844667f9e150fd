package uromanjava;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * Universal romanizer: converts text in any script to Latin letters.
 *
 * <p>Each call resolves the applicable rule sets, builds a lattice of
 * candidate edges, selects the least-cost covering path and projects the
 * result into one of the {@link RomFormat} views.</p>
 *
 * <pre>{@code
 * Uroman uroman = new Uroman();
 * uroman.romanizeString("こんにちは");          // "kon'nichiha"
 * uroman.romanize("مرحبا", "ara", RomFormat.EDGES).getEdges();
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe. All per-call state (lattice,
 * path, alternates) is owned by the call; the {@link RuleStore} is shared and
 * read-only.</p>
 */
public class Uroman {
    /**
     * Internal logger used for rule loading and diagnostic messages.
     * Logging is disabled by default to keep library output quiet.
     */
    static final Logger LOGGER = Logger.getLogger(Uroman.class.getName());

    static {
        // Disable logging by default
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * System property naming a rule directory that replaces the default rule data.
     */
    public static final String RULES_DIR_PROPERTY = "uroman.rules.dir";

    /**
     * Enables or disables verbose logging.
     * <p>
     * When enabled, the logger reports which rule data was loaded and from
     * where. When disabled (default), logging is suppressed.
     * </p>
     *
     * @param enabled {@code true} to enable logging, {@code false} to disable it
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    /**
     * Lazily loaded, process-wide default {@link RuleStore}.
     *
     * <p>The store is resolved in the following order (on first access only):</p>
     * <ol>
     *   <li>The rule directory named by the system property {@code uroman.rules.dir}.</li>
     *   <li>JSON snapshot {@code rules/rule_store.json} on the file system.</li>
     *   <li>JSON snapshot {@code /rules/rule_store.json} on the class path.</li>
     *   <li>The rule directory {@code rules} (file system, then class path).</li>
     * </ol>
     *
     * <pre>{@code
     * RuleStore store = Uroman.RuleStoreHolder.get();
     * }</pre>
     */
    public static final class RuleStoreHolder {
        private RuleStoreHolder() {
        }

        private static class Holder {
            private static final RuleStore DEFAULT = load();
        }

        /**
         * Returns the shared store, loading it on first invocation.
         *
         * @return the shared store
         * @throws RuleLoadException if no rule data can be loaded
         */
        public static RuleStore get() {
            return Holder.DEFAULT;
        }

        private static RuleStore load() {
            String dir = System.getProperty(RULES_DIR_PROPERTY);
            if (dir != null && !dir.trim().isEmpty()) {
                LOGGER.info("Loading rules from " + RULES_DIR_PROPERTY + "=" + dir);
                return logged(RuleStore.fromRules(dir.trim()));
            }
            try {
                Path jsonPath = Paths.get("rules", RuleStoreSnapshot.FILE_NAME);
                if (Files.exists(jsonPath)) {
                    LOGGER.info("Loading rule snapshot " + jsonPath.toAbsolutePath());
                    return logged(RuleStore.fromJson(jsonPath.toString()));
                }
                try (InputStream in = RuleStore.class.getResourceAsStream("/rules/" + RuleStoreSnapshot.FILE_NAME)) {
                    if (in != null) {
                        LOGGER.info("Loading bundled rule snapshot");
                        return logged(RuleStore.fromJson(in));
                    }
                }
            } catch (IOException e) {
                throw new RuleLoadException("Failed to load rule snapshot", e);
            }
            LOGGER.info("No rule snapshot found, loading rule files");
            return logged(RuleStore.fromRules());
        }

        private static RuleStore logged(RuleStore store) {
            LOGGER.info("Loaded " + store);
            return store;
        }
    }

    private final RuleStore store;
    private final UromanOptions options;
    private final ScriptResolver resolver;
    private final LatticeBuilder latticeBuilder = new LatticeBuilder();
    private final PathSelector pathSelector = new PathSelector();

    /**
     * Creates a romanizer over the default rule data with default options.
     *
     * @throws RuleLoadException if the default rule data cannot be loaded
     */
    public Uroman() {
        this(UromanOptions.defaults());
    }

    /**
     * Creates a romanizer with the given options. The rule directory of the
     * options, when set, is loaded for this instance only; otherwise the shared
     * default store is used.
     *
     * @param options romanizer options
     * @throws RuleLoadException if rule data cannot be loaded
     */
    public Uroman(UromanOptions options) {
        this(options.getRuleDirectory() != null
                ? RuleStore.fromRules(options.getRuleDirectory())
                : RuleStoreHolder.get(), options);
    }

    /**
     * Creates a romanizer over an explicit store with default options.
     */
    public Uroman(RuleStore store) {
        this(store, UromanOptions.defaults());
    }

    /**
     * Creates a romanizer over an explicit store.
     *
     * @param store   the rule store
     * @param options romanizer options ({@link UromanOptions#getRuleDirectory()} is ignored)
     */
    public Uroman(RuleStore store, UromanOptions options) {
        this.store = Objects.requireNonNull(store, "store");
        this.options = Objects.requireNonNull(options, "options");
        this.resolver = new ScriptResolver(store, options.isStrict());
    }

    public RuleStore getStore() {
        return store;
    }

    public UromanOptions getOptions() {
        return options;
    }

    /**
     * @return known language codes and their English names
     */
    public Map<String, String> getLanguages() {
        return store.getLanguages().asMap();
    }

    /**
     * Romanizes one line and returns the full resolution.
     *
     * @param text  one line of text
     * @param lcode optional ISO 639-3 language code ({@code null} for detection)
     * @return the lattice, best path and alternates
     * @throws NullPointerException         if {@code text} is {@code null}
     * @throws UnknownLanguageCodeException in strict mode, for an unknown code
     */
    public ResolvedOutput romanize(String text, String lcode) {
        Objects.requireNonNull(text, "text");
        List<RuleSet> ruleSets = resolver.resolve(lcode, text);
        Lattice lattice = latticeBuilder.build(text, ruleSets);
        return pathSelector.select(lattice, ruleSets);
    }

    /**
     * Romanizes one line into the given view.
     */
    public RomanizationResult romanize(String text, String lcode, RomFormat format) {
        Objects.requireNonNull(format, "format");
        return ProjectionLayer.project(romanize(text, lcode), format);
    }

    /**
     * Romanizes one line into the view named by {@code format}.
     *
     * @param format {@code "str"}, {@code "edges"}, {@code "alts"} or {@code "lattice"}
     * @throws InvalidFormatException if {@code format} is not one of these
     */
    public RomanizationResult romanize(String text, String lcode, String format) {
        RomFormat f = RomFormat.fromStr(format);
        return romanize(text, lcode, f);
    }

    /**
     * Romanizes one line with script detection only.
     *
     * @param text one line of text
     * @return the romanized string
     */
    public String romanizeString(String text) {
        return romanizeString(text, null);
    }

    /**
     * Romanizes one line.
     *
     * @param text  one line of text
     * @param lcode optional ISO 639-3 language code
     * @return the romanized string
     */
    public String romanizeString(String text, String lcode) {
        return ProjectionLayer.toStr(romanize(text, lcode));
    }

    /**
     * Decodes Unicode escapes in {@code text}, then romanizes it.
     *
     * @see UnicodeEscapes#decode(String)
     */
    public RomanizationResult romanizeEscaped(String text, String lcode, RomFormat format) {
        Objects.requireNonNull(text, "text");
        return romanize(UnicodeEscapes.decode(text), lcode, format);
    }

    /**
     * Romanizes multi-line text line by line.
     *
     * <p>Lines are split on {@code \n}, {@code \r\n} and {@code \r}; every
     * line break is kept verbatim and blank lines pass through. Large inputs
     * are processed on a parallel stream and reassembled in order.</p>
     *
     * @param text  the text
     * @param lcode optional ISO 639-3 language code
     * @return the romanized text
     * @throws UnknownLanguageCodeException in strict mode, for an unknown code, even if {@code text} is empty
     */
    public String romanizeText(String text, String lcode) {
        Objects.requireNonNull(text, "text");
        resolver.checkLanguageCode(lcode);
        if (text.isEmpty()) return text;

        final List<int[]> ranges = getLineRanges(text);
        final int numLines = ranges.size();
        final String[] out = new String[numLines];

        boolean useParallel = numLines > options.getParallelLines() || text.length() > options.getParallelChars();
        if (useParallel) {
            IntStream.range(0, numLines).parallel().forEach(i -> out[i] = romanizeRange(text, ranges.get(i), lcode));
        } else {
            for (int i = 0; i < numLines; i++) {
                out[i] = romanizeRange(text, ranges.get(i), lcode);
            }
        }

        StringBuilder sb = new StringBuilder(text.length() + (text.length() >> 2));
        for (int i = 0; i < numLines; i++) {
            int[] r = ranges.get(i);
            sb.append(out[i]).append(text, r[1], r[2]);
        }
        return sb.toString();
    }

    private String romanizeRange(String text, int[] range, String lcode) {
        if (range[0] == range[1]) return "";
        return romanizeString(text.substring(range[0], range[1]), lcode);
    }

    /**
     * Splits text into lines.
     *
     * @return per line {@code {start, endOfContent, endOfLineBreak}} as char indexes
     */
    static List<int[]> getLineRanges(String text) {
        List<int[]> ranges = new ArrayList<>();
        final int len = text.length();
        int start = 0;
        int i = 0;
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                int breakEnd = (c == '\r' && i + 1 < len && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                ranges.add(new int[]{start, i, breakEnd});
                start = breakEnd;
                i = breakEnd;
            } else {
                i++;
            }
        }
        if (start < len) {
            ranges.add(new int[]{start, len, len});
        }
        return ranges;
    }

    /**
     * Romanizes a line-oriented stream.
     *
     * <p>{@code str} results are written as plain lines; the other views as
     * one JSON array per input line (see {@link EdgeJson}).</p>
     *
     * @param in            input lines
     * @param out           destination; not closed
     * @param lcode         optional ISO 639-3 language code
     * @param format        output view
     * @param maxLines      maximum number of lines to process, or {@code null} for all
     * @param decodeUnicode decode Unicode escapes in each line first
     * @return the number of lines processed
     * @throws IOException if reading or writing fails
     * @throws UnknownLanguageCodeException in strict mode, for an unknown code, even if {@code in} is empty
     */
    public int romanizeFile(BufferedReader in, Writer out, String lcode, RomFormat format,
                            Integer maxLines, boolean decodeUnicode) throws IOException {
        Objects.requireNonNull(format, "format");
        resolver.checkLanguageCode(lcode);
        int count = 0;
        for (String line; (maxLines == null || count < maxLines) && (line = in.readLine()) != null; ) {
            if (decodeUnicode) line = UnicodeEscapes.decode(line);
            RomanizationResult result = romanize(line, lcode, format);
            out.write(format == RomFormat.STR ? result.getText() : EdgeJson.toJson(result));
            out.write('\n');
            count++;
        }
        out.flush();
        LOGGER.log(Level.FINE, "Romanized {0} lines", count);
        return count;
    }

    @Override
    public String toString() {
        return "Uroman(" + store + ", " + options + ")";
    }
}
