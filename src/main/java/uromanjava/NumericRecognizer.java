package uromanjava;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Detects number spans in a line.
 *
 * <p>Two families are recognized:</p>
 * <ul>
 *   <li>Decimal digit runs of any single Unicode digit system, with an
 *       optional leading sign ({@code -}, {@code +}, U+2212), grouping
 *       separators ({@code ,}, U+066C) and one decimal separator
 *       ({@code .}, U+066B).</li>
 *   <li>CJK numeral runs ({@code 二十三}, {@code 一万二千}, {@code 一九八四}).</li>
 * </ul>
 *
 * <p>A run whose separators or numeral units cannot be read unambiguously
 * yields nothing; its characters are left to textual and fallback edges.
 * Recognition only starts at a run boundary, so one run yields at most one
 * numeral.</p>
 */
public final class NumericRecognizer {
    private static final int MINUS_SIGN = 0x2212;
    private static final int ARABIC_THOUSANDS_SEPARATOR = 0x066C;
    private static final int ARABIC_DECIMAL_SEPARATOR = 0x066B;

    private static final String CJK_DIGITS = "〇零一二两三四五六七八九";
    private static final int[] CJK_DIGIT_VALUES = {0, 0, 1, 2, 2, 3, 4, 5, 6, 7, 8, 9};

    /**
     * A recognized number span.
     */
    public static final class Numeral {
        private final int start;
        private final int end;
        private final double value;
        private final String text;

        Numeral(int start, int end, double value, String text) {
            this.start = start;
            this.end = end;
            this.value = value;
            this.text = text;
        }

        public int getStart() {
            return start;
        }

        public int getEnd() {
            return end;
        }

        public double getValue() {
            return value;
        }

        /**
         * @return the value written with ASCII digits
         */
        public String getText() {
            return text;
        }

        @Override
        public String toString() {
            return "Numeral(" + start + ".." + end + " = " + text + ")";
        }
    }

    private NumericRecognizer() {
    }

    /**
     * Scans for a number starting exactly at {@code start}.
     *
     * @param lattice the lattice holding the line
     * @param start   code-point offset
     * @return the numeral, or {@code null} if none starts there
     */
    public static Numeral scan(Lattice lattice, int start) {
        final int cp = lattice.codePointAt(start);
        if (isSign(cp) || isDecimalDigit(cp)) {
            return scanDecimal(lattice, start);
        }
        if (cjkDigit(cp) >= 0 || cjkUnit(cp) > 0) {
            return scanCjk(lattice, start);
        }
        return null;
    }

    // ---- decimal digit systems ----

    private static Numeral scanDecimal(Lattice lattice, int start) {
        final int n = lattice.length();
        int pos = start;
        boolean negative = false;

        if (isSign(lattice.codePointAt(pos))) {
            if (pos + 1 >= n || !isDecimalDigit(lattice.codePointAt(pos + 1))) return null;
            if (start > 0 && isDecimalDigit(lattice.codePointAt(start - 1))) return null;
            negative = lattice.codePointAt(pos) != '+';
            pos++;
        }

        final int zero = zeroOf(lattice.codePointAt(pos));
        if (!atRunBoundary(lattice, pos, zero)) return null;

        StringBuilder ascii = new StringBuilder();
        boolean decimalSeen = false;
        boolean groupingSeen = false;
        int leadingDigits = 0;

        while (pos < n) {
            int c = lattice.codePointAt(pos);
            if (sameSystem(c, zero)) {
                ascii.append((char) ('0' + (c - zero)));
                if (!decimalSeen && !groupingSeen) leadingDigits++;
                pos++;
                continue;
            }
            boolean digitFollows = pos + 1 < n && sameSystem(lattice.codePointAt(pos + 1), zero);
            if (!digitFollows) break;

            if (isGroupingSeparator(c)) {
                if (decimalSeen || leadingDigits > 3) return null;
                int group = countDigits(lattice, pos + 1, zero);
                if (group != 3) return null;
                groupingSeen = true;
                pos++;
            } else if (isDecimalSeparator(c)) {
                if (decimalSeen) return null;
                decimalSeen = true;
                ascii.append('.');
                pos++;
            } else {
                break;
            }
        }

        BigDecimal value = new BigDecimal(ascii.toString());
        if (negative) value = value.negate();
        return new Numeral(start, pos, value.doubleValue(), render(value));
    }

    private static boolean atRunBoundary(Lattice lattice, int pos, int zero) {
        if (pos == 0) return true;
        int prev = lattice.codePointAt(pos - 1);
        if (sameSystem(prev, zero)) return false;
        if ((isGroupingSeparator(prev) || isDecimalSeparator(prev))
                && pos >= 2 && sameSystem(lattice.codePointAt(pos - 2), zero)) {
            return false;
        }
        return true;
    }

    private static int countDigits(Lattice lattice, int from, int zero) {
        int i = from;
        while (i < lattice.length() && sameSystem(lattice.codePointAt(i), zero)) i++;
        return i - from;
    }

    private static String render(BigDecimal value) {
        BigDecimal v = value.stripTrailingZeros();
        if (v.signum() == 0) return "0";
        if (v.scale() < 0) v = v.setScale(0);
        return v.toPlainString();
    }

    private static boolean isSign(int cp) {
        return cp == '-' || cp == '+' || cp == MINUS_SIGN;
    }

    private static boolean isGroupingSeparator(int cp) {
        return cp == ',' || cp == ARABIC_THOUSANDS_SEPARATOR;
    }

    private static boolean isDecimalSeparator(int cp) {
        return cp == '.' || cp == ARABIC_DECIMAL_SEPARATOR;
    }

    private static boolean isDecimalDigit(int cp) {
        return Character.getType(cp) == Character.DECIMAL_DIGIT_NUMBER;
    }

    private static int zeroOf(int digit) {
        return digit - Character.digit(digit, 10);
    }

    private static boolean sameSystem(int cp, int zero) {
        return isDecimalDigit(cp) && zeroOf(cp) == zero;
    }

    // ---- CJK numerals ----

    private static Numeral scanCjk(Lattice lattice, int start) {
        if (start > 0 && isCjkNumeral(lattice.codePointAt(start - 1))) return null;
        int end = start;
        while (end < lattice.length() && isCjkNumeral(lattice.codePointAt(end))) end++;

        BigInteger value = composeCjk(lattice, start, end);
        if (value == null) return null;
        return new Numeral(start, end, value.doubleValue(), value.toString());
    }

    /**
     * Composes a CJK numeral run, or returns {@code null} if it is ambiguous.
     */
    static BigInteger composeCjk(Lattice lattice, int start, int end) {
        boolean hasUnit = false;
        for (int i = start; i < end; i++) {
            if (cjkUnit(lattice.codePointAt(i)) > 0) {
                hasUnit = true;
                break;
            }
        }

        if (!hasUnit) {
            // Positional digits: 一九八四
            StringBuilder digits = new StringBuilder(end - start);
            for (int i = start; i < end; i++) {
                digits.append((char) ('0' + cjkDigit(lattice.codePointAt(i))));
            }
            return new BigInteger(digits.toString());
        }

        long total = 0;
        long section = 0;
        int pending = -1;
        boolean afterZero = false;
        long lastSmall = Long.MAX_VALUE;
        long lastBig = Long.MAX_VALUE;
        long lastUnit = 0;

        for (int i = start; i < end; i++) {
            int cp = lattice.codePointAt(i);
            int d = cjkDigit(cp);
            if (d == 0) {
                if (pending >= 0) return null;
                afterZero = true;
                continue;
            }
            if (d > 0) {
                if (pending >= 0) return null;
                pending = d;
                continue;
            }
            long unit = cjkUnit(cp);
            if (unit < 10_000) {
                if (unit >= lastSmall) return null;
                int n;
                if (pending >= 0) {
                    n = pending;
                } else if (unit == 10 && section == 0 && !afterZero) {
                    n = 1;
                } else {
                    return null;
                }
                section += n * unit;
                lastSmall = unit;
                lastUnit = unit;
            } else {
                if (unit >= lastBig) return null;
                if (pending >= 0) section += pending;
                if (section == 0) return null;
                total += section * unit;
                section = 0;
                lastBig = unit;
                lastSmall = Long.MAX_VALUE;
                lastUnit = unit;
            }
            pending = -1;
            afterZero = false;
        }

        if (pending >= 0) {
            // 二百五 and 一万五 read as 250 and 15000 colloquially; refuse rather than guess.
            if (!afterZero && lastUnit > 10) return null;
            section += pending;
        }
        return BigInteger.valueOf(total + section);
    }

    private static boolean isCjkNumeral(int cp) {
        return cjkDigit(cp) >= 0 || cjkUnit(cp) > 0;
    }

    private static int cjkDigit(int cp) {
        int idx = CJK_DIGITS.indexOf(cp);
        return idx < 0 ? -1 : CJK_DIGIT_VALUES[idx];
    }

    private static long cjkUnit(int cp) {
        switch (cp) {
            case '十':
                return 10;
            case '百':
                return 100;
            case '千':
                return 1_000;
            case '万':
            case '萬':
                return 10_000;
            case '亿':
            case '億':
                return 100_000_000;
            default:
                return 0;
        }
    }
}
