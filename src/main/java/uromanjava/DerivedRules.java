package uromanjava;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rules computed once from Unicode data for the generic rule set.
 *
 * <ul>
 *   <li>Latin letters with diacritics (U+00C0–U+024F, U+1E00–U+1EFF) map to
 *       the ASCII letters of their canonical decomposition
 *       ({@code é} → {@code e}); letters whose decomposition is not plain
 *       ASCII are skipped.</li>
 *   <li>Full-width ASCII forms (U+FF01–U+FF5E) map to ASCII.</li>
 * </ul>
 *
 * <p>Code points that already have an explicit generic rule are left alone.</p>
 */
final class DerivedRules {
    private static final int[][] LATIN_RANGES = {{0x00C0, 0x024F}, {0x1E00, 0x1EFF}};
    private static final int FULLWIDTH_FIRST = 0xFF01;
    private static final int FULLWIDTH_LAST = 0xFF5E;
    private static final int FULLWIDTH_OFFSET = 0xFEE0;

    private DerivedRules() {
    }

    /**
     * Appends derived rules to a generic rule list.
     *
     * @param explicit   the rules read from the generic rule file
     * @param firstOrder registration index for the first derived rule
     * @return explicit rules followed by derived ones
     */
    static List<Rule> extend(List<Rule> explicit, int firstOrder) {
        Set<String> taken = new HashSet<>();
        for (Rule r : explicit) taken.add(r.getSource());

        List<Rule> out = new ArrayList<>(explicit);
        int order = firstOrder;

        for (int[] range : LATIN_RANGES) {
            for (int cp = range[0]; cp <= range[1]; cp++) {
                String src = new String(Character.toChars(cp));
                if (taken.contains(src) || !Character.isLetter(cp)) continue;
                String base = stripMarks(src);
                if (base == null || base.equals(src)) continue;
                out.add(new Rule(src, Collections.singletonList(base), 1.0, null, null, order++));
                taken.add(src);
            }
        }

        for (int cp = FULLWIDTH_FIRST; cp <= FULLWIDTH_LAST; cp++) {
            String src = new String(Character.toChars(cp));
            if (taken.contains(src)) continue;
            String ascii = String.valueOf((char) (cp - FULLWIDTH_OFFSET));
            out.add(new Rule(src, Collections.singletonList(ascii), 1.0, null, null, order++));
        }

        return out;
    }

    /**
     * Decomposes {@code s} and drops combining marks.
     *
     * @return the ASCII letters left, or {@code null} if anything non-ASCII remains
     */
    static String stripMarks(String s) {
        String nfd = Normalizer.normalize(s, Normalizer.Form.NFD);
        StringBuilder sb = new StringBuilder(nfd.length());
        for (int i = 0; i < nfd.length(); ) {
            int cp = nfd.codePointAt(i);
            i += Character.charCount(cp);
            int type = Character.getType(cp);
            if (type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK) continue;
            if (cp > 0x7F || !Character.isLetter(cp)) return null;
            sb.append((char) cp);
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
