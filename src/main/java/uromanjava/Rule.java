package uromanjava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One substring→romanization rule of a {@link RuleSet}.
 *
 * <p>A rule matches its {@code source} exactly (code point for code point) and
 * may be guarded by context expressions:</p>
 * <ul>
 *   <li>{@code left}: a regular expression that must match a suffix of the
 *       line before the span ({@code ^} matches the line start)</li>
 *   <li>{@code right}: a regular expression that must match a prefix of the
 *       line after the span ({@code $} matches the line end)</li>
 * </ul>
 *
 * <p>The first target is the primary romanization; further targets are
 * alternatives, each {@link #ALTERNATE_PENALTY} more expensive than the one
 * before it.</p>
 *
 * <p>Instances are immutable.</p>
 */
public final class Rule {
    /**
     * Extra cost per alternative position.
     */
    public static final double ALTERNATE_PENALTY = 0.25;

    private final String source;
    private final int sourceLength;
    private final List<String> targets;
    private final double cost;
    private final String left;
    private final String right;
    private final Pattern leftPattern;
    private final Pattern rightPattern;
    private final int order;

    /**
     * Creates a rule.
     *
     * @param source  the non-empty source span
     * @param targets primary target followed by alternatives (at least one)
     * @param cost    non-negative cost of the primary target
     * @param left    left-context expression, or {@code null}
     * @param right   right-context expression, or {@code null}
     * @param order   global registration index
     * @throws IllegalArgumentException                if arguments are out of range
     * @throws java.util.regex.PatternSyntaxException if a context expression is invalid
     */
    public Rule(String source, List<String> targets, double cost, String left, String right, int order) {
        if (source == null || source.isEmpty()) {
            throw new IllegalArgumentException("Rule source must not be empty");
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("Rule for '" + source + "' has no target");
        }
        if (!(cost >= 0.0) || Double.isInfinite(cost)) {
            throw new IllegalArgumentException("Invalid cost " + cost + " for '" + source + "'");
        }
        this.source = source;
        this.sourceLength = source.codePointCount(0, source.length());
        this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
        this.cost = cost;
        this.left = emptyToNull(left);
        this.right = emptyToNull(right);
        this.leftPattern = this.left == null ? null : Pattern.compile("(?:" + this.left + ")\\z");
        this.rightPattern = this.right == null ? null : Pattern.compile(this.right);
        this.order = order;
    }

    private static String emptyToNull(String s) {
        return (s == null || s.isEmpty()) ? null : s;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return the source length in code points
     */
    public int getSourceLength() {
        return sourceLength;
    }

    /**
     * @return primary target followed by alternatives (read-only)
     */
    public List<String> getTargets() {
        return targets;
    }

    public double getCost() {
        return cost;
    }

    /**
     * Returns the cost of the candidate at {@code index} in {@link #getTargets()}.
     *
     * @param index candidate index
     * @return the candidate cost
     */
    public double candidateCost(int index) {
        return cost + ALTERNATE_PENALTY * index;
    }

    public String getLeft() {
        return left;
    }

    public String getRight() {
        return right;
    }

    public int getOrder() {
        return order;
    }

    /**
     * @return {@code true} if the rule has a left or right context
     */
    public boolean isContextual() {
        return leftPattern != null || rightPattern != null;
    }

    /**
     * Tests the context expressions of this rule for a span of a lattice line.
     *
     * @param lattice the lattice holding the line
     * @param start   inclusive code-point start of the span
     * @param end     exclusive code-point end of the span
     * @return {@code true} if both contexts (when present) are satisfied
     */
    boolean contextMatches(Lattice lattice, int start, int end) {
        final String line = lattice.getLine();
        if (leftPattern != null) {
            Matcher m = leftPattern.matcher(line);
            m.region(0, lattice.charIndex(start));
            if (!m.find()) return false;
        }
        if (rightPattern != null) {
            Matcher m = rightPattern.matcher(line);
            m.region(lattice.charIndex(end), line.length());
            return m.lookingAt();
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rule)) return false;
        Rule r = (Rule) o;
        return order == r.order && Double.compare(cost, r.cost) == 0
                && source.equals(r.source) && targets.equals(r.targets)
                && Objects.equals(left, r.left) && Objects.equals(right, r.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, targets, cost, left, right, order);
    }

    @Override
    public String toString() {
        return "Rule(" + source + " -> " + targets + ", cost=" + cost
                + (left != null ? ", left=" + left : "")
                + (right != null ? ", right=" + right : "") + ")";
    }
}
