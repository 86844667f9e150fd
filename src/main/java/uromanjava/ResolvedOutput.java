package uromanjava;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one romanization call produced: the lattice, the best path,
 * the ranked alternates of each best-path edge and the rule sets that were
 * applied.
 *
 * <p>Created per call and never shared; every view returned is read-only, so
 * any number of projections can be taken from one instance.</p>
 */
public final class ResolvedOutput {
    private final Lattice lattice;
    private final LatticePath bestPath;
    private final List<List<Edge>> alternates;
    private final List<RuleSet> ruleSets;

    ResolvedOutput(Lattice lattice, LatticePath bestPath, List<List<Edge>> alternates, List<RuleSet> ruleSets) {
        if (alternates.size() != bestPath.size()) {
            throw new IllegalArgumentException("Expected " + bestPath.size() + " alternate lists, got " + alternates.size());
        }
        this.lattice = lattice;
        this.bestPath = bestPath;
        List<List<Edge>> alts = new ArrayList<>(alternates.size());
        for (List<Edge> a : alternates) alts.add(Collections.unmodifiableList(new ArrayList<>(a)));
        this.alternates = Collections.unmodifiableList(alts);
        this.ruleSets = Collections.unmodifiableList(new ArrayList<>(ruleSets));
    }

    public Lattice getLattice() {
        return lattice;
    }

    public LatticePath getBestPath() {
        return bestPath;
    }

    /**
     * @return the original line
     */
    public String getLine() {
        return lattice.getLine();
    }

    /**
     * Returns the ranked alternates of every best-path edge, aligned with
     * {@link LatticePath#getEdges()}.
     *
     * @return one (possibly empty) list per best-path edge
     */
    public List<List<Edge>> getAlternates() {
        return alternates;
    }

    /**
     * @param offset a code-point offset
     * @return the alternates of the best-path edge starting at {@code offset},
     * or an empty list if no best-path edge starts there
     */
    public List<Edge> alternatesAt(int offset) {
        List<Edge> edges = bestPath.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            if (edges.get(i).getStart() == offset) return alternates.get(i);
        }
        return Collections.emptyList();
    }

    /**
     * @return the rule sets applied, highest priority first
     */
    public List<RuleSet> getRuleSets() {
        return ruleSets;
    }
}
