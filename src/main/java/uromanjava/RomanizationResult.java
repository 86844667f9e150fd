package uromanjava;

import java.util.List;

/**
 * One projected view of a romanization.
 *
 * <p>Exactly one accessor matches the {@link RomFormat} of the result:
 * {@link #getText()} for {@code str}, {@link #getEdges()} for {@code edges} and
 * {@code lattice}, {@link #getAnnotatedEdges()} for {@code alts}. The others
 * throw {@link IllegalStateException}.</p>
 */
public final class RomanizationResult {
    private final RomFormat format;
    private final String text;
    private final List<Edge> edges;
    private final List<AnnotatedEdge> annotatedEdges;

    private RomanizationResult(RomFormat format, String text, List<Edge> edges, List<AnnotatedEdge> annotatedEdges) {
        this.format = format;
        this.text = text;
        this.edges = edges;
        this.annotatedEdges = annotatedEdges;
    }

    static RomanizationResult ofText(String text) {
        return new RomanizationResult(RomFormat.STR, text, null, null);
    }

    static RomanizationResult ofEdges(RomFormat format, List<Edge> edges) {
        return new RomanizationResult(format, null, edges, null);
    }

    static RomanizationResult ofAnnotated(List<AnnotatedEdge> annotatedEdges) {
        return new RomanizationResult(RomFormat.ALTS, null, null, annotatedEdges);
    }

    public RomFormat getFormat() {
        return format;
    }

    /**
     * @return the romanized string ({@code str})
     */
    public String getText() {
        check(text != null, RomFormat.STR);
        return text;
    }

    /**
     * @return the best-path edges ({@code edges}) or all lattice edges ({@code lattice})
     */
    public List<Edge> getEdges() {
        check(edges != null, RomFormat.EDGES);
        return edges;
    }

    /**
     * @return the best-path edges with alternates ({@code alts})
     */
    public List<AnnotatedEdge> getAnnotatedEdges() {
        check(annotatedEdges != null, RomFormat.ALTS);
        return annotatedEdges;
    }

    private void check(boolean present, RomFormat wanted) {
        if (!present) {
            throw new IllegalStateException("Result has format '" + format.asStr()
                    + "', not '" + wanted.asStr() + "'");
        }
    }

    @Override
    public String toString() {
        switch (format) {
            case STR:
                return text;
            case ALTS:
                return annotatedEdges.toString();
            default:
                return edges.toString();
        }
    }
}
