package uromanjava;

import java.util.ArrayList;
import java.util.List;

/**
 * Least-cost tiling of a {@link Lattice}.
 *
 * <p>Offsets {@code 0..n} are the nodes of a DAG whose arcs are the lattice
 * edges. The best completion of every offset is computed from the end of the
 * line backwards. Candidates at an offset are ordered by:</p>
 * <ol>
 *   <li>total cost of the resulting path, rounded to multiples of {@value #COST_EPSILON}</li>
 *   <li>rank of the edge (higher-priority rule set first)</li>
 *   <li>number of edges in the resulting path (fewer, i.e. longer spans, first)</li>
 *   <li>registration order of the producing rule</li>
 *   <li>creation order of the edge</li>
 * </ol>
 * <p>The last key is unique within a lattice, so the best path is unique.</p>
 */
public final class PathSelector {
    static final double COST_EPSILON = 1e-9;

    /**
     * Selects the best path and the alternates at each best-path offset.
     *
     * @param lattice  a fully covered lattice
     * @param ruleSets the rule sets the lattice was built from
     * @return the resolved output
     * @throws IllegalStateException if the lattice start cannot reach the line end
     */
    public ResolvedOutput select(Lattice lattice, List<RuleSet> ruleSets) {
        final int n = lattice.length();
        final double[] cost = new double[n + 1];
        final int[] count = new int[n + 1];
        final Edge[] choice = new Edge[n + 1];
        final boolean[] reachable = new boolean[n + 1];
        reachable[n] = true;

        for (int i = n - 1; i >= 0; i--) {
            Edge best = null;
            for (Edge e : lattice.edgesFrom(i)) {
                if (!reachable[e.getEnd()]) continue;
                if (best == null || compare(e, best, cost, count) < 0) best = e;
            }
            if (best != null) {
                reachable[i] = true;
                choice[i] = best;
                cost[i] = best.getCost() + cost[best.getEnd()];
                count[i] = 1 + count[best.getEnd()];
            }
        }

        if (!reachable[0]) {
            throw new IllegalStateException("No complete path through lattice of '" + lattice.getLine()
                    + "' (first uncovered offset " + lattice.firstUncoveredOffset() + ")");
        }

        final List<Edge> pathEdges = new ArrayList<>(count[0]);
        final List<List<Edge>> alternates = new ArrayList<>(count[0]);
        for (int i = 0; i < n; i = choice[i].getEnd()) {
            final Edge chosen = choice[i];
            pathEdges.add(chosen);

            List<Edge> alts = new ArrayList<>();
            for (Edge e : lattice.edgesFrom(i)) {
                if (e != chosen && reachable[e.getEnd()]) alts.add(e);
            }
            alts.sort((a, b) -> compare(a, b, cost, count));
            alternates.add(alts);
        }

        return new ResolvedOutput(lattice, new LatticePath(pathEdges, cost[0]), alternates, ruleSets);
    }

    /**
     * Orders two edges starting at the same offset by the completions they lead to.
     */
    private static int compare(Edge a, Edge b, double[] cost, int[] count) {
        int c = Long.compare(costKey(a.getCost() + cost[a.getEnd()]), costKey(b.getCost() + cost[b.getEnd()]));
        if (c != 0) return c;

        c = Integer.compare(a.getRank(), b.getRank());
        if (c != 0) return c;

        c = Integer.compare(count[a.getEnd()], count[b.getEnd()]);
        if (c != 0) return c;

        c = Integer.compare(a.getOrder(), b.getOrder());
        if (c != 0) return c;

        return Integer.compare(a.getSerial(), b.getSerial());
    }

    /**
     * Rounds a path cost onto a fixed grid so that sums reached in different
     * orders compare equal and the ordering stays transitive.
     */
    static long costKey(double c) {
        return Math.round(c / COST_EPSILON);
    }
}
