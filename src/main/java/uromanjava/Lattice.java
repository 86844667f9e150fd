package uromanjava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All candidate edges produced for one input line.
 *
 * <p>The lattice owns its edges and hands out read-only views. It is created
 * per call by {@link LatticeBuilder} and never shared between calls.</p>
 *
 * <p>Invariant once built: every offset {@code 0..length()-1} is the start of
 * at least one edge ({@link #firstUncoveredOffset()} returns {@code -1}).</p>
 */
public final class Lattice {
    private final String line;
    private final int[] codePoints;
    /**
     * UTF-16 index of each code point offset, with one extra slot for the line end.
     */
    private final int[] charIndex;
    private final List<Edge> edges = new ArrayList<>();
    private final List<List<Edge>> edgesByStart;

    Lattice(String line) {
        this.line = line;
        this.codePoints = line.codePoints().toArray();
        this.charIndex = new int[codePoints.length + 1];
        int ci = 0;
        for (int i = 0; i < codePoints.length; i++) {
            charIndex[i] = ci;
            ci += Character.charCount(codePoints[i]);
        }
        charIndex[codePoints.length] = ci;

        this.edgesByStart = new ArrayList<>(codePoints.length);
        for (int i = 0; i < codePoints.length; i++) {
            edgesByStart.add(new ArrayList<>(2));
        }
    }

    /**
     * @return the original line
     */
    public String getLine() {
        return line;
    }

    /**
     * @return the line length in code points
     */
    public int length() {
        return codePoints.length;
    }

    /**
     * @param offset a code-point offset
     * @return the code point at that offset
     */
    public int codePointAt(int offset) {
        return codePoints[offset];
    }

    /**
     * Converts a code-point offset into an index into {@link #getLine()}.
     *
     * @param offset a code-point offset in {@code 0..length()}
     * @return the matching UTF-16 index
     */
    public int charIndex(int offset) {
        return charIndex[offset];
    }

    /**
     * Returns the original text of a code-point span.
     *
     * @param start inclusive start offset
     * @param end   exclusive end offset
     * @return the substring of the line
     */
    public String substring(int start, int end) {
        return line.substring(charIndex[start], charIndex[end]);
    }

    /**
     * @return all edges in creation order (unfiltered, read-only)
     */
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * @param offset a code-point offset in {@code 0..length()-1}
     * @return the edges starting at that offset, in creation order (read-only)
     */
    public List<Edge> edgesFrom(int offset) {
        return Collections.unmodifiableList(edgesByStart.get(offset));
    }

    /**
     * @return number of edges
     */
    public int size() {
        return edges.size();
    }

    /**
     * Returns the first offset that starts no edge.
     *
     * @return the offset, or {@code -1} if every offset is covered
     */
    public int firstUncoveredOffset() {
        for (int i = 0; i < edgesByStart.size(); i++) {
            if (edgesByStart.get(i).isEmpty()) return i;
        }
        return -1;
    }

    // ---- construction (package-private, used by LatticeBuilder) ----

    Edge addRuleEdge(int start, int end, String text, EdgeType type, double cost,
                     int rank, int order, String source) {
        return add(new Edge(start, end, text, type, null, null, cost, rank, order, edges.size(), source));
    }

    Edge addNumericEdge(int start, int end, String text, double value, double cost) {
        return add(new Edge(start, end, text, EdgeType.NUMERIC, value, substring(start, end),
                cost, Edge.NUMERIC_RANK, Edge.NO_RULE_ORDER, edges.size(), null));
    }

    Edge addPassThroughEdge(int offset, EdgeType type, double cost) {
        return add(new Edge(offset, offset + 1, substring(offset, offset + 1), type, null, null,
                cost, Edge.PASS_THROUGH_RANK, Edge.NO_RULE_ORDER, edges.size(), null));
    }

    private Edge add(Edge e) {
        if (e.getEnd() > codePoints.length) {
            throw new IllegalArgumentException("Edge " + e + " exceeds line length " + codePoints.length);
        }
        edges.add(e);
        edgesByStart.get(e.getStart()).add(e);
        return e;
    }
}
