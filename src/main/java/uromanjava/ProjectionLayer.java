package uromanjava;

import java.util.ArrayList;
import java.util.List;

/**
 * The four views over a {@link ResolvedOutput}. All methods are pure; none
 * mutates its argument.
 */
public final class ProjectionLayer {

    private ProjectionLayer() {
    }

    /**
     * Concatenates the best path's edge texts in offset order.
     */
    public static String toStr(ResolvedOutput output) {
        List<Edge> edges = output.getBestPath().getEdges();
        StringBuilder sb = new StringBuilder(output.getLine().length() + 16);
        for (Edge e : edges) {
            sb.append(e.getText());
        }
        return sb.toString();
    }

    /**
     * @return the best path's edges in offset order (read-only)
     */
    public static List<Edge> toEdges(ResolvedOutput output) {
        return output.getBestPath().getEdges();
    }

    /**
     * @return the best path's edges, each annotated with its ranked alternates
     */
    public static List<AnnotatedEdge> toAlts(ResolvedOutput output) {
        List<Edge> edges = output.getBestPath().getEdges();
        List<List<Edge>> alts = output.getAlternates();
        List<AnnotatedEdge> out = new ArrayList<>(edges.size());
        for (int i = 0; i < edges.size(); i++) {
            out.add(new AnnotatedEdge(edges.get(i), alts.get(i)));
        }
        return out;
    }

    /**
     * @return every lattice edge, unfiltered, in creation order (read-only)
     */
    public static List<Edge> toLattice(ResolvedOutput output) {
        return output.getLattice().getEdges();
    }

    /**
     * Projects a resolved output into the requested view.
     *
     * @param output the resolved output
     * @param format the view
     * @return the projected result
     */
    public static RomanizationResult project(ResolvedOutput output, RomFormat format) {
        switch (format) {
            case STR:
                return RomanizationResult.ofText(toStr(output));
            case EDGES:
                return RomanizationResult.ofEdges(RomFormat.EDGES, toEdges(output));
            case ALTS:
                return RomanizationResult.ofAnnotated(toAlts(output));
            case LATTICE:
                return RomanizationResult.ofEdges(RomFormat.LATTICE, toLattice(output));
            default:
                throw new InvalidFormatException(String.valueOf(format));
        }
    }
}
