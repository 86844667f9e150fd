package uromanjava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A gap-free, non-overlapping sequence of edges covering a whole line.
 */
public final class LatticePath {
    private final List<Edge> edges;
    private final double cost;

    LatticePath(List<Edge> edges, double cost) {
        int expected = 0;
        for (Edge e : edges) {
            if (e.getStart() != expected) {
                throw new IllegalStateException("Path is not contiguous at offset " + expected + ": " + e);
            }
            expected = e.getEnd();
        }
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.cost = cost;
    }

    /**
     * @return the edges in offset order (read-only)
     */
    public List<Edge> getEdges() {
        return edges;
    }

    /**
     * @return the sum of the edge costs
     */
    public double getCost() {
        return cost;
    }

    public int size() {
        return edges.size();
    }

    /**
     * @return the end offset of the last edge (the line length)
     */
    public int length() {
        return edges.isEmpty() ? 0 : edges.get(edges.size() - 1).getEnd();
    }

    @Override
    public String toString() {
        return "LatticePath(cost=" + cost + ", edges=" + edges + ")";
    }
}
