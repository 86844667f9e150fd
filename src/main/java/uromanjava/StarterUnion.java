package uromanjava;

import java.util.*;

/**
 * Immutable index of the "starter" code points of a rule set.
 * <p>
 * A starter is the first code point of a rule source. By precomputing the set
 * of all starters, the lattice builder can skip offsets where no rule of the
 * set can possibly begin, before building any substring.
 * </p>
 *
 * <p>
 * Internally two {@link BitSet}s are kept:
 * <ul>
 *   <li>{@code bmpMask} – starters in the Basic Multilingual Plane
 *       (U+0000 to U+FFFF)</li>
 *   <li>{@code astralMask} – starters in the Supplementary Planes
 *       (U+10000 to U+10FFFF), stored as an offset from {@code BMP_LIMIT}</li>
 * </ul>
 * Alongside presence, a per-starter 64-bit length mask records which source
 * lengths (in code points) exist for that starter.
 * </p>
 *
 * <p>
 * Instances are immutable and thread-safe once constructed.
 * </p>
 */
public final class StarterUnion {
    /**
     * Maximum code point value for the Basic Multilingual Plane (U+0000–U+FFFF).
     */
    private static final int BMP_LIMIT = 0x10000;
    /**
     * Maximum Unicode code point value (U+10FFFF).
     */
    private static final int UNICODE_MAX = 0x10FFFF;

    private final BitSet bmpMask;    // U+0000 to U+FFFF
    private final BitSet astralMask; // U+10000 to U+10FFFF, stored as (cp - 0x10000)

    /**
     * Per-starter length masks: bit {@code L} is set if a rule source of
     * {@code L} code points begins with the starter. Sources of 64 code points
     * or more are not represented and always looked up.
     */
    private final long[] bmpLenMask;
    private final Map<Integer, Long> astralLenMask;

    private StarterUnion(BitSet bmpMask, BitSet astralMask,
                         long[] bmpLenMask,
                         Map<Integer, Long> astralLenMask) {
        this.bmpMask = bmpMask;
        this.astralMask = astralMask;
        this.bmpLenMask = bmpLenMask;
        this.astralLenMask = Collections.unmodifiableMap(astralLenMask);
    }

    /**
     * Builds a {@code StarterUnion} from the sources of the given rules.
     *
     * @param rules the rules to scan
     * @return an immutable union of their starters and source lengths
     */
    public static StarterUnion build(Collection<Rule> rules) {
        final BitSet bmp = new BitSet(BMP_LIMIT);
        final BitSet astral = new BitSet((UNICODE_MAX - BMP_LIMIT) + 1);
        final long[] bmpLen = new long[BMP_LIMIT];
        final Map<Integer, Long> astralLen = new HashMap<>();

        for (Rule rule : rules) {
            final String k = rule.getSource();
            final int cp = k.codePointAt(0);

            if (cp < BMP_LIMIT) bmp.set(cp);
            else astral.set(cp - BMP_LIMIT);

            final int len = rule.getSourceLength();
            final long bit = len < 64 ? 1L << len : LONG_SOURCE_BIT;
            if (cp < BMP_LIMIT) {
                bmpLen[cp] |= bit;
            } else {
                astralLen.merge(cp, bit, (a, b) -> a | b);
            }
        }

        return new StarterUnion(bmp, astral, bmpLen, astralLen);
    }

    /**
     * Bit 0 is never a valid length, so it flags "has a source of 64+ code points".
     */
    private static final long LONG_SOURCE_BIT = 1L;

    /**
     * Checks whether any rule source starts with the given code point.
     *
     * @param codePoint the Unicode code point to test
     * @return {@code true} if at least one source starts with this code point
     */
    public boolean hasStarter(int codePoint) {
        if (codePoint < 0) return false;
        if (codePoint < BMP_LIMIT) return bmpMask.get(codePoint);
        if (codePoint <= UNICODE_MAX) return astralMask.get(codePoint - BMP_LIMIT);
        return false;
    }

    /**
     * Tests whether a source of {@code length} code points may start with {@code cp}.
     *
     * @param cp     the starter code point
     * @param length candidate source length in code points
     * @return {@code false} only if no such source exists
     */
    public boolean mayMatch(int cp, int length) {
        final long mask = lenMask(cp);
        if (length >= 64) return (mask & LONG_SOURCE_BIT) != 0L;
        return ((mask >>> length) & 1L) != 0L;
    }

    /**
     * Returns the precomputed length bitmask for the given starter code point.
     *
     * @param cp the Unicode code point to query
     * @return a 64-bit length mask; {@code 0} if no source starts with {@code cp}
     */
    public long lenMask(int cp) {
        if (cp < 0 || cp > UNICODE_MAX) return 0L;
        if (cp < BMP_LIMIT) return bmpLenMask[cp];
        return astralLenMask.getOrDefault(cp, 0L);
    }
}
