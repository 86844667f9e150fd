package uromanjava;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@link Lattice} of one line from the resolved rule sets.
 *
 * <p>At each code-point offset every rule set contributes one edge per
 * candidate target of every matching rule, and the {@link NumericRecognizer}
 * contributes at most one numeric edge. An offset no rule matches gets a
 * single-code-point pass-through edge ({@code whitespace} or
 * {@code fallback}), which keeps the lattice fully covered.</p>
 *
 * <p>Instances are stateless; all per-call state lives in the returned lattice.</p>
 */
public final class LatticeBuilder {
    /**
     * Cost of numeric and pass-through edges.
     */
    static final double DEFAULT_EDGE_COST = 1.0;

    /**
     * Builds the lattice for a line.
     *
     * @param line     one input line without line terminators
     * @param ruleSets resolved rule sets, highest priority first
     * @return a fully covered lattice
     */
    public Lattice build(String line, List<RuleSet> ruleSets) {
        final Lattice lattice = new Lattice(line);
        final int n = lattice.length();
        final List<Rule> matches = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            boolean matched = false;

            for (int rank = 0; rank < ruleSets.size(); rank++) {
                final RuleSet rs = ruleSets.get(rank);
                final EdgeType type = EdgeType.forRuleSet(rs.getKind());
                matches.clear();
                rs.collectMatches(lattice, i, matches);
                for (Rule r : matches) {
                    final int end = i + r.getSourceLength();
                    final List<String> targets = r.getTargets();
                    for (int t = 0; t < targets.size(); t++) {
                        lattice.addRuleEdge(i, end, targets.get(t), type, r.candidateCost(t),
                                rank, r.getOrder(), rs.getId());
                    }
                    matched = true;
                }
            }

            NumericRecognizer.Numeral num = NumericRecognizer.scan(lattice, i);
            if (num != null) {
                lattice.addNumericEdge(num.getStart(), num.getEnd(), num.getText(), num.getValue(), DEFAULT_EDGE_COST);
            }

            if (!matched) {
                final EdgeType type = Character.isWhitespace(lattice.codePointAt(i))
                        || Character.isSpaceChar(lattice.codePointAt(i))
                        ? EdgeType.WHITESPACE : EdgeType.FALLBACK;
                lattice.addPassThroughEdge(i, type, DEFAULT_EDGE_COST);
            }
        }

        assert lattice.firstUncoveredOffset() == -1
                : "Lattice leaves offset " + lattice.firstUncoveredOffset() + " uncovered: " + line;
        return lattice;
    }
}
