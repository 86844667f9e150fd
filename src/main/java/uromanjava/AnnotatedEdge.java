package uromanjava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A best-path edge together with its ranked alternates ({@code alts} view).
 */
public final class AnnotatedEdge {
    private final Edge edge;
    private final List<Edge> alternates;

    public AnnotatedEdge(Edge edge, List<Edge> alternates) {
        this.edge = edge;
        this.alternates = Collections.unmodifiableList(new ArrayList<>(alternates));
    }

    public Edge getEdge() {
        return edge;
    }

    /**
     * @return competing edges starting at the same offset, best first (read-only)
     */
    public List<Edge> getAlternates() {
        return alternates;
    }

    @Override
    public String toString() {
        return edge + " alternates=" + alternates;
    }
}
