package uromanjava;

import java.util.Objects;

/**
 * A candidate romanization of one contiguous span of an input line.
 *
 * <p>Offsets are half-open code-point offsets into the original line
 * ({@code start < end}). Edges are immutable and owned by the {@link Lattice}
 * that created them.</p>
 *
 * <p>Besides the visible record ({@code start}, {@code end}, {@code text},
 * {@code edge_type}, numeric data) an edge carries the ranking data used by
 * {@link PathSelector}:</p>
 * <ul>
 *   <li>{@code cost}: contribution to the path cost (lower wins)</li>
 *   <li>{@code rank}: position of the producing rule set in resolver order;
 *       numeric and pass-through edges rank after every rule set</li>
 *   <li>{@code order}: global registration index of the producing rule</li>
 *   <li>{@code serial}: creation index within the lattice</li>
 * </ul>
 */
public final class Edge {
    /**
     * Rank of numeric edges: after all rule sets, before pass-through edges.
     */
    static final int NUMERIC_RANK = Integer.MAX_VALUE - 1;
    /**
     * Rank of whitespace and fallback edges.
     */
    static final int PASS_THROUGH_RANK = Integer.MAX_VALUE;
    /**
     * Registration order of edges not produced by a rule.
     */
    static final int NO_RULE_ORDER = Integer.MAX_VALUE;

    private final int start;
    private final int end;
    private final String text;
    private final EdgeType type;
    private final Double value;
    private final String origText;
    private final double cost;
    private final int rank;
    private final int order;
    private final int serial;
    private final String source;

    Edge(int start, int end, String text, EdgeType type, Double value, String origText,
         double cost, int rank, int order, int serial, String source) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid edge span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.text = Objects.requireNonNull(text, "text");
        this.type = Objects.requireNonNull(type, "type");
        this.value = value;
        this.origText = origText;
        this.cost = cost;
        this.rank = rank;
        this.order = order;
        this.serial = serial;
        this.source = source;
    }

    /**
     * @return inclusive start offset, in code points
     */
    public int getStart() {
        return start;
    }

    /**
     * @return exclusive end offset, in code points
     */
    public int getEnd() {
        return end;
    }

    /**
     * @return the romanized text of this span (may be empty)
     */
    public String getText() {
        return text;
    }

    /**
     * @return the kind of this edge
     */
    public EdgeType getType() {
        return type;
    }

    /**
     * @return the external tag of {@link #getType()}
     */
    public String getEdgeType() {
        return type.tag();
    }

    /**
     * @return {@code true} for edges produced by the numeric recognizer
     */
    public boolean isNumeric() {
        return type == EdgeType.NUMERIC;
    }

    /**
     * @return the parsed value of a numeric edge, {@code null} otherwise
     */
    public Double getValue() {
        return value;
    }

    /**
     * @return the untouched original substring of a numeric edge, {@code null} otherwise
     */
    public String getOrigText() {
        return origText;
    }

    public double getCost() {
        return cost;
    }

    public int getRank() {
        return rank;
    }

    public int getOrder() {
        return order;
    }

    public int getSerial() {
        return serial;
    }

    /**
     * @return id of the rule set that produced this edge, or {@code null} for non-rule edges
     */
    public String getSource() {
        return source;
    }

    /**
     * @return number of code points covered
     */
    public int length() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge)) return false;
        Edge e = (Edge) o;
        return start == e.start && end == e.end && serial == e.serial
                && Double.compare(cost, e.cost) == 0
                && rank == e.rank && order == e.order
                && text.equals(e.text) && type == e.type
                && Objects.equals(value, e.value)
                && Objects.equals(origText, e.origText)
                && Objects.equals(source, e.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, text, type, serial);
    }

    @Override
    public String toString() {
        return "Edge(start=" + start + ", end=" + end + ", text='" + text + "', type='" + type.tag() + "')";
    }
}
