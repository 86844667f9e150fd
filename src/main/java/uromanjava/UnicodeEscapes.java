package uromanjava;

/**
 * Decodes <code>&#92;uXXXX</code> and <code>&#92;UXXXXXXXX</code> escapes in
 * text before romanization.
 *
 * <p>Escaped surrogate pairs (<code>&#92;ud83d&#92;ude00</code>) combine into
 * one code point. Malformed escapes (too few hex digits, values above
 * U+10FFFF) are kept literally.</p>
 */
public final class UnicodeEscapes {

    private UnicodeEscapes() {
    }

    /**
     * Replaces every well-formed escape in {@code text}.
     *
     * @param text input text
     * @return the decoded text; {@code text} itself if it contains no backslash
     */
    public static String decode(String text) {
        if (text.indexOf('\\') < 0) return text;

        final int len = text.length();
        StringBuilder sb = new StringBuilder(len);
        int i = 0;
        while (i < len) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= len) {
                sb.append(c);
                i++;
                continue;
            }
            char kind = text.charAt(i + 1);
            int digits = kind == 'u' ? 4 : kind == 'U' ? 8 : 0;
            int cp = digits == 0 ? -1 : parseHex(text, i + 2, digits);
            if (cp < 0 || cp > Character.MAX_CODE_POINT) {
                sb.append(c);
                i++;
                continue;
            }
            sb.appendCodePoint(cp);
            i += 2 + digits;
        }
        // Escaped surrogate halves land next to each other as a valid UTF-16 pair.
        return sb.toString();
    }

    private static int parseHex(String s, int from, int count) {
        if (from + count > s.length()) return -1;
        int v = 0;
        for (int i = from; i < from + count; i++) {
            int d = Character.digit(s.charAt(i), 16);
            if (d < 0) return -1;
            v = (v << 4) | d;
            if (v < 0) return -1;
        }
        return v;
    }
}
