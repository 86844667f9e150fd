package uromanjava;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UnicodeEscapesTest {

    @Test
    @DisplayName("Should decode short and long escapes")
    void testDecode() {
        assertThat(UnicodeEscapes.decode("caf\\u00e9")).isEqualTo("café");
        assertThat(UnicodeEscapes.decode("\\u041f\\u0440\\u0438")).isEqualTo("При");
        assertThat(UnicodeEscapes.decode("x\\U0001F600y"))
                .isEqualTo("x" + new String(Character.toChars(0x1F600)) + "y");
    }

    @Test
    @DisplayName("Escaped surrogate pairs should combine into one code point")
    void testSurrogatePair() {
        String decoded = UnicodeEscapes.decode("\\ud83d\\ude00");

        assertThat(decoded).isEqualTo(new String(Character.toChars(0x1F600)));
        assertThat(decoded.codePointCount(0, decoded.length())).isEqualTo(1);
    }

    @Test
    @DisplayName("Malformed escapes should be kept literally")
    void testMalformed() {
        assertThat(UnicodeEscapes.decode("\\u12")).isEqualTo("\\u12");
        assertThat(UnicodeEscapes.decode("\\uzzzz")).isEqualTo("\\uzzzz");
        assertThat(UnicodeEscapes.decode("\\U00110000")).isEqualTo("\\U00110000");
        assertThat(UnicodeEscapes.decode("a\\nb\\")).isEqualTo("a\\nb\\");
    }

    @Test
    void testNoEscapes() {
        String plain = "plain text";

        assertThat(UnicodeEscapes.decode(plain)).isSameAs(plain);
    }
}
