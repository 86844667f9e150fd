package uromanjava;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Parser for rule text files.
 *
 * <p>File format rules:</p>
 * <ul>
 *   <li>Each line holds a source span, a TAB, a target, and optionally more
 *       TAB-separated {@code key=value} attributes.</li>
 *   <li>Attributes: {@code cost} (decimal, default 1.0), {@code alt}
 *       (alternative target, repeatable), {@code left} and {@code right}
 *       (context expressions, see {@link Rule}).</li>
 *   <li>In targets, {@code \t}, {@code \s} and {@code \\} stand for a TAB, a
 *       space and a backslash. An empty target is allowed.</li>
 *   <li>Blank lines and lines starting with {@code #} are ignored.</li>
 *   <li>If the first line starts with a BOM ({@code U+FEFF}), it is stripped.</li>
 * </ul>
 *
 * <p>Any malformed line fails the whole load with a {@link RuleLoadException}
 * naming the file and line.</p>
 */
final class RuleFileParser {
    private static final double DEFAULT_COST = 1.0;

    private RuleFileParser() {
    }

    /**
     * Parses a rule file from a stream.
     *
     * @param in         a stream of UTF-8 text
     * @param name       file name used in error messages
     * @param firstOrder registration index of the first rule
     * @return the rules in file order
     * @throws IOException if the stream cannot be read
     */
    static List<Rule> parse(InputStream in, String name, int firstOrder) throws IOException {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(br, name, firstOrder);
        }
    }

    /**
     * Parses rule lines.
     *
     * @param br         a reader supplying UTF-8 text
     * @param name       file name used in error messages
     * @param firstOrder registration index of the first rule
     * @return the rules in file order
     * @throws IOException       if reading fails
     * @throws RuleLoadException if a line is malformed
     */
    static List<Rule> parse(BufferedReader br, String name, int firstOrder) throws IOException {
        List<Rule> rules = new ArrayList<>();
        int lineNo = 0;

        for (String raw; (raw = br.readLine()) != null; ) {
            lineNo++;
            String line = raw;
            if (lineNo == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                line = line.substring(1); // strip BOM
            }
            if (line.trim().isEmpty() || line.startsWith("#")) continue;

            String[] fields = line.split("\t", -1);
            if (fields.length < 2) {
                throw RuleLoadException.atLine(name, lineNo, "missing TAB", raw);
            }

            String source = fields[0];
            if (source.isEmpty()) {
                throw RuleLoadException.atLine(name, lineNo, "empty source", raw);
            }

            List<String> targets = new ArrayList<>(1);
            targets.add(unescape(fields[1], name, lineNo, raw));
            double cost = DEFAULT_COST;
            String left = null;
            String right = null;

            for (int f = 2; f < fields.length; f++) {
                String attr = fields[f];
                if (attr.isEmpty()) continue;
                int eq = attr.indexOf('=');
                if (eq <= 0) {
                    throw RuleLoadException.atLine(name, lineNo, "attribute without '='", raw);
                }
                String key = attr.substring(0, eq);
                String value = attr.substring(eq + 1);
                switch (key) {
                    case "cost":
                        cost = parseCost(value, name, lineNo, raw);
                        break;
                    case "alt":
                        targets.add(unescape(value, name, lineNo, raw));
                        break;
                    case "left":
                        left = value;
                        break;
                    case "right":
                        right = value;
                        break;
                    default:
                        throw RuleLoadException.atLine(name, lineNo, "unknown attribute '" + key + "'", raw);
                }
            }

            try {
                rules.add(new Rule(source, targets, cost, left, right, firstOrder + rules.size()));
            } catch (PatternSyntaxException e) {
                throw RuleLoadException.atLine(name, lineNo, "invalid context expression (" + e.getDescription() + ")", raw);
            }
        }

        return rules;
    }

    private static double parseCost(String value, String name, int lineNo, String raw) {
        final double cost;
        try {
            cost = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw RuleLoadException.atLine(name, lineNo, "unparsable cost '" + value + "'", raw);
        }
        if (!(cost >= 0.0) || Double.isInfinite(cost)) {
            throw RuleLoadException.atLine(name, lineNo, "cost must be a finite non-negative number", raw);
        }
        return cost;
    }

    /**
     * Resolves {@code \t}, {@code \s} and {@code \\} in a target.
     */
    static String unescape(String s, String name, int lineNo, String raw) {
        if (s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= s.length()) {
                throw RuleLoadException.atLine(name, lineNo, "dangling backslash", raw);
            }
            char next = s.charAt(++i);
            switch (next) {
                case 't':
                    sb.append('\t');
                    break;
                case 's':
                    sb.append(' ');
                    break;
                case '\\':
                    sb.append('\\');
                    break;
                default:
                    throw RuleLoadException.atLine(name, lineNo, "unknown escape '\\" + next + "'", raw);
            }
        }
        return sb.toString();
    }
}
