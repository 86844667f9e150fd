package uromanjava;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * The ordered list of rule sets making up a rule directory
 * ({@code rulesets.json}).
 *
 * <p>Example entry:</p>
 * <pre>{@code
 * {"id": "Cyrl", "kind": "script", "file": "cyrillic.txt", "scripts": ["CYRILLIC"]}
 * }</pre>
 */
public final class RuleSetManifest {
    /**
     * Manifest file name inside a rule directory.
     */
    public static final String FILE_NAME = "rulesets.json";

    /**
     * One rule set declaration.
     */
    public static class Entry {
        /**
         * Unique rule set id (ISO 639-3 code for language rule sets).
         */
        public String id;
        /**
         * {@code language}, {@code script} or {@code generic}.
         */
        public String kind;
        /**
         * Rule file name, relative to the rule directory.
         */
        public String file;
        /**
         * {@link Character.UnicodeScript} names served by the rule set.
         */
        public List<String> scripts = new ArrayList<>();
        /**
         * Optional id of a rule set tried right after this one.
         */
        public String parent;

        /**
         * Constructs an empty entry (for deserialization).
         */
        public Entry() {
        }
    }

    private RuleSetManifest() {
    }

    /**
     * Reads manifest entries from JSON.
     *
     * @param in the JSON input stream
     * @return entries in declaration order
     * @throws IOException if the JSON cannot be read or does not match the entry shape
     */
    public static List<Entry> read(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(in, new TypeReference<List<Entry>>() {
        });
    }
}
