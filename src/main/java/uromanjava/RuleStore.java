package uromanjava;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.*;
import java.lang.Character.UnicodeScript;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * The read-only collection of all rule sets plus the language registry.
 *
 * <p>This class supports loading from:
 * <ul>
 *     <li>A JSON snapshot ({@code rule_store.json}, used in deployments)</li>
 *     <li>A rule directory: {@code rulesets.json}, the rule files it lists and
 *         {@code languages.tsv} (used during development or as fallback)</li>
 * </ul>
 *
 * <p>Loading is a one-time, fail-fast operation: anything malformed raises a
 * {@link RuleLoadException}. Once constructed a store is never mutated, so a
 * single instance can serve any number of concurrent romanization calls.</p>
 */
public final class RuleStore {
    private final List<RuleSet> ruleSets;
    private final Map<String, RuleSet> byId;
    private final Map<UnicodeScript, List<RuleSet>> byScript;
    private final RuleSet generic;
    private final LanguageRegistry languages;

    /**
     * Creates a store from already built rule sets.
     *
     * @param ruleSets  rule sets in declaration order; exactly one must be {@link RuleSet.Kind#GENERIC}
     * @param languages the language registry
     * @throws RuleLoadException if ids repeat, a parent is unknown, or the generic set is missing or repeated
     */
    public RuleStore(List<RuleSet> ruleSets, LanguageRegistry languages) {
        this.ruleSets = Collections.unmodifiableList(new ArrayList<>(ruleSets));
        this.languages = Objects.requireNonNull(languages, "languages");

        Map<String, RuleSet> ids = new LinkedHashMap<>();
        Map<UnicodeScript, List<RuleSet>> scripts = new EnumMap<>(UnicodeScript.class);
        RuleSet gen = null;

        for (RuleSet rs : this.ruleSets) {
            if (ids.put(rs.getId(), rs) != null) {
                throw new RuleLoadException("Duplicate rule set id: " + rs.getId());
            }
            switch (rs.getKind()) {
                case GENERIC:
                    if (gen != null) {
                        throw new RuleLoadException("More than one generic rule set: " + gen.getId() + ", " + rs.getId());
                    }
                    gen = rs;
                    break;
                case SCRIPT:
                    if (rs.getScripts().isEmpty()) {
                        throw new RuleLoadException("Script rule set " + rs.getId() + " declares no scripts");
                    }
                    for (UnicodeScript s : rs.getScripts()) {
                        scripts.computeIfAbsent(s, k -> new ArrayList<>(1)).add(rs);
                    }
                    break;
                case LANGUAGE:
                    break;
                default:
                    throw new RuleLoadException("Unhandled rule set kind: " + rs.getKind());
            }
        }
        if (gen == null) {
            throw new RuleLoadException("No generic rule set declared");
        }
        for (RuleSet rs : this.ruleSets) {
            if (rs.getParent() != null && !ids.containsKey(rs.getParent())) {
                throw new RuleLoadException("Rule set " + rs.getId() + " names unknown parent " + rs.getParent());
            }
        }
        for (Map.Entry<UnicodeScript, List<RuleSet>> e : scripts.entrySet()) {
            e.setValue(Collections.unmodifiableList(e.getValue()));
        }

        this.byId = Collections.unmodifiableMap(ids);
        this.byScript = Collections.unmodifiableMap(scripts);
        this.generic = gen;
    }

    /**
     * @return all rule sets in declaration order (read-only)
     */
    public List<RuleSet> getRuleSets() {
        return ruleSets;
    }

    /**
     * @param id a rule set id
     * @return the rule set, or {@code null} if there is none
     */
    public RuleSet getRuleSet(String id) {
        return id == null ? null : byId.get(id);
    }

    /**
     * @param code a normalized language code
     * @return the language rule set for the code, or {@code null}
     */
    public RuleSet languageRuleSet(String code) {
        RuleSet rs = getRuleSet(code);
        return (rs != null && rs.getKind() == RuleSet.Kind.LANGUAGE) ? rs : null;
    }

    /**
     * @param script a Unicode script
     * @return the script rule sets serving it, in declaration order (possibly empty)
     */
    public List<RuleSet> scriptRuleSets(UnicodeScript script) {
        List<RuleSet> hit = byScript.get(script);
        return hit != null ? hit : Collections.emptyList();
    }

    /**
     * @return the generic fallback rule set
     */
    public RuleSet getGeneric() {
        return generic;
    }

    /**
     * @return the language registry
     */
    public LanguageRegistry getLanguages() {
        return languages;
    }

    /**
     * @return total number of rules across all rule sets
     */
    public int ruleCount() {
        int n = 0;
        for (RuleSet rs : ruleSets) n += rs.getRules().size();
        return n;
    }

    /**
     * Returns a human-readable summary of the loaded rule data.
     */
    @Override
    public String toString() {
        return "<RuleStore with " + ruleSets.size() + " rule sets, " + ruleCount() + " rules, "
                + languages.size() + " languages>";
    }

    // ---------------------------------------------------------------------
    // Loading from a rule directory
    // ---------------------------------------------------------------------

    /**
     * Loads the rule directory {@code "rules"} (file system first, then class path).
     *
     * @return a fully populated store
     * @throws RuleLoadException if any rule data is missing or malformed
     */
    public static RuleStore fromRules() {
        return fromRules("rules");
    }

    /**
     * Loads a rule directory.
     * <p>
     * For the manifest, the language registry and each rule file listed in the
     * manifest:
     * </p>
     * <ol>
     *   <li>First attempts to load from the filesystem path {@code basePath/filename}.</li>
     *   <li>If the file does not exist, falls back to the class path resource
     *       {@code /basePath/filename}.</li>
     * </ol>
     * <p>
     * Rules are numbered in manifest order, then file order; the generic rule
     * set is extended with {@link DerivedRules} after its explicit rules.
     * </p>
     *
     * @param basePath the directory (filesystem or classpath) containing the rule data
     * @return a fully populated store
     * @throws RuleLoadException if any rule data is missing or malformed
     */
    public static RuleStore fromRules(String basePath) {
        final List<RuleSetManifest.Entry> entries;
        try (InputStream in = open(basePath, RuleSetManifest.FILE_NAME)) {
            entries = RuleSetManifest.read(in);
        } catch (IOException ex) {
            throw new RuleLoadException("Error loading manifest " + basePath + "/" + RuleSetManifest.FILE_NAME
                    + ": " + ex.getMessage(), ex);
        }

        final LanguageRegistry languages;
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(open(basePath, LanguageRegistry.FILE_NAME), StandardCharsets.UTF_8))) {
            languages = LanguageRegistry.parse(br, LanguageRegistry.FILE_NAME);
        } catch (IOException ex) {
            throw new RuleLoadException("Error loading " + basePath + "/" + LanguageRegistry.FILE_NAME, ex);
        }

        List<RuleSet> sets = new ArrayList<>(entries.size());
        int order = 0;
        List<Integer> genericSlots = new ArrayList<>(1);

        for (RuleSetManifest.Entry entry : entries) {
            if (entry.id == null || entry.id.trim().isEmpty()) {
                throw new RuleLoadException("Manifest entry without id in " + basePath);
            }
            if (entry.file == null || entry.file.trim().isEmpty()) {
                throw new RuleLoadException("Manifest entry " + entry.id + " names no rule file");
            }
            final RuleSet.Kind kind = checkDeclaration("Manifest entry", entry.id, entry.kind);
            final List<UnicodeScript> scripts = parseScripts(entry.id, entry.scripts);

            final List<Rule> rules;
            try (InputStream in = open(basePath, entry.file)) {
                rules = RuleFileParser.parse(in, entry.file, order);
            } catch (IOException ex) {
                throw new RuleLoadException("Error loading rules: " + entry.id + " (" + entry.file + ")", ex);
            }
            order += rules.size();

            if (kind == RuleSet.Kind.GENERIC) genericSlots.add(sets.size());
            sets.add(new RuleSet(entry.id, kind, scripts, entry.parent, rules));
        }

        // Derived rules are appended once, after every explicit rule has its number.
        if (genericSlots.size() == 1) {
            int slot = genericSlots.get(0);
            RuleSet g = sets.get(slot);
            sets.set(slot, new RuleSet(g.getId(), g.getKind(), g.getScripts(), g.getParent(),
                    DerivedRules.extend(g.getRules(), order)));
        }

        return new RuleStore(sets, languages);
    }

    /**
     * Validates the id and kind of a declared rule set.
     *
     * @param what how the declaration is named in error messages
     * @return the parsed kind
     * @throws RuleLoadException if the kind is unknown or a language id is not an ISO 639-3 code
     */
    private static RuleSet.Kind checkDeclaration(String what, String id, String kindName) {
        final RuleSet.Kind kind;
        try {
            kind = RuleSet.Kind.fromStr(kindName);
        } catch (IllegalArgumentException ex) {
            throw new RuleLoadException(what + " " + id + " has unknown kind: " + kindName, ex);
        }
        if (kind == RuleSet.Kind.LANGUAGE && !LanguageRegistry.isWellFormed(id)) {
            throw new RuleLoadException("Language rule set id is not an ISO 639-3 code: " + id);
        }
        return kind;
    }

    private static List<UnicodeScript> parseScripts(String id, List<String> names) {
        List<UnicodeScript> scripts = new ArrayList<>();
        if (names == null) return scripts;
        for (String name : names) {
            try {
                scripts.add(UnicodeScript.forName(name));
            } catch (IllegalArgumentException | NullPointerException ex) {
                throw new RuleLoadException("Rule set " + id + " names unknown script: " + name, ex);
            }
        }
        return scripts;
    }

    /**
     * Opens {@code basePath/filename} from the filesystem, or else from the class path.
     */
    private static InputStream open(String basePath, String filename) throws IOException {
        final Path fsPath = Paths.get(basePath, filename);
        if (Files.exists(fsPath)) {
            return Files.newInputStream(fsPath);
        }
        final String resPath = "/" + basePath.replace('\\', '/') + "/" + filename;
        InputStream in = RuleStore.class.getResourceAsStream(resPath);
        if (in == null) throw new FileNotFoundException("Missing resource: " + resPath +
                " (also checked FS: " + fsPath.toAbsolutePath() + ")");
        return in;
    }

    // ---------------------------------------------------------------------
    // JSON snapshot
    // ---------------------------------------------------------------------

    /**
     * Loads a store from a JSON snapshot file.
     *
     * @param jsonFile the JSON file to read
     * @return the store
     * @throws IOException       if reading fails
     * @throws RuleLoadException if the snapshot content is invalid
     */
    public static RuleStore fromJson(File jsonFile) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return fromSnapshot(mapper.readValue(jsonFile, RuleStoreSnapshot.class));
    }

    /**
     * Loads a store from a JSON snapshot file path.
     *
     * @param path the file path
     * @return the store
     * @throws IOException if reading fails
     */
    public static RuleStore fromJson(String path) throws IOException {
        return fromJson(new File(path));
    }

    /**
     * Loads a store from a JSON snapshot stream, typically a class path resource
     * such as {@code /rules/rule_store.json}.
     *
     * @param in the input stream containing the JSON data
     * @return the store
     * @throws IOException if the JSON cannot be read or parsed
     */
    public static RuleStore fromJson(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return fromSnapshot(mapper.readValue(in, RuleStoreSnapshot.class));
    }

    private static RuleStore fromSnapshot(RuleStoreSnapshot snap) {
        if (snap == null || snap.ruleSets == null) {
            throw new RuleLoadException("Snapshot declares no rule sets");
        }
        List<RuleSet> sets = new ArrayList<>(snap.ruleSets.size());
        for (RuleStoreSnapshot.RuleSetData d : snap.ruleSets) {
            if (d == null || d.id == null || d.id.trim().isEmpty()) {
                throw new RuleLoadException("Snapshot rule set without id");
            }
            final RuleSet.Kind kind = checkDeclaration("Snapshot rule set", d.id, d.kind);
            if (d.rules == null) {
                throw new RuleLoadException("Snapshot rule set " + d.id + " has no rule list");
            }
            List<Rule> rules = new ArrayList<>(d.rules.size());
            for (RuleStoreSnapshot.RuleData r : d.rules) {
                if (r == null || r.targets == null || r.targets.contains(null)) {
                    throw new RuleLoadException("Snapshot rule set " + d.id + " has an incomplete rule");
                }
                try {
                    rules.add(r.toRule());
                } catch (IllegalArgumentException ex) {
                    throw new RuleLoadException("Snapshot rule set " + d.id + " has an invalid rule: " + ex.getMessage(), ex);
                }
            }
            sets.add(new RuleSet(d.id, kind, parseScripts(d.id, d.scripts), d.parent, rules));
        }
        if (snap.languages == null) {
            throw new RuleLoadException("Snapshot has no language registry");
        }
        final LanguageRegistry languages;
        try {
            languages = new LanguageRegistry(snap.languages);
        } catch (IllegalArgumentException ex) {
            throw new RuleLoadException("Snapshot language registry is invalid: " + ex.getMessage(), ex);
        }
        return new RuleStore(sets, languages);
    }

    /**
     * Builds the JSON snapshot of this store.
     *
     * @return a snapshot holding every rule set, rule and language
     */
    public RuleStoreSnapshot toSnapshot() {
        RuleStoreSnapshot snap = new RuleStoreSnapshot();
        for (RuleSet rs : ruleSets) {
            RuleStoreSnapshot.RuleSetData d = new RuleStoreSnapshot.RuleSetData();
            d.id = rs.getId();
            d.kind = rs.getKind().name().toLowerCase(Locale.ROOT);
            for (UnicodeScript s : rs.getScripts()) d.scripts.add(s.name());
            d.parent = rs.getParent();
            for (Rule r : rs.getRules()) d.rules.add(new RuleStoreSnapshot.RuleData(r));
            snap.ruleSets.add(d);
        }
        snap.languages.putAll(languages.asMap());
        return snap;
    }

    /**
     * Serializes this store to a JSON snapshot file.
     *
     * @param outputPath the output path where the JSON should be written
     * @throws RuntimeException if writing the file fails
     */
    public void serializeToJson(String outputPath) {
        ObjectMapper mapper = new ObjectMapper();
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(Paths.get(outputPath)), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, toSnapshot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to write JSON to: " + outputPath, e);
        }
    }
}
