package uromanjava;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NumericRecognizerTest {

    private static NumericRecognizer.Numeral scan(String line, int start) {
        return NumericRecognizer.scan(new Lattice(line), start);
    }

    @Test
    @DisplayName("Should read a plain digit run")
    void testPlainDigits() {
        NumericRecognizer.Numeral n = scan("123", 0);

        assertThat(n).isNotNull();
        assertThat(n.getStart()).isEqualTo(0);
        assertThat(n.getEnd()).isEqualTo(3);
        assertThat(n.getValue()).isEqualTo(123.0);
        assertThat(n.getText()).isEqualTo("123");
    }

    @Test
    @DisplayName("Should read signs, grouping and decimal separators")
    void testSeparators() {
        NumericRecognizer.Numeral grouped = scan("1,234,567 items", 0);
        assertThat(grouped.getEnd()).isEqualTo(9);
        assertThat(grouped.getValue()).isEqualTo(1234567.0);
        assertThat(grouped.getText()).isEqualTo("1234567");

        NumericRecognizer.Numeral negative = scan("-4.50", 0);
        assertThat(negative.getEnd()).isEqualTo(5);
        assertThat(negative.getValue()).isEqualTo(-4.5);
        assertThat(negative.getText()).isEqualTo("-4.5");

        NumericRecognizer.Numeral mixed = scan("12,345.67", 0);
        assertThat(mixed.getValue()).isEqualTo(12345.67);
    }

    @Test
    @DisplayName("A trailing separator should end the run")
    void testTrailingSeparator() {
        NumericRecognizer.Numeral n = scan("3. Next", 0);

        assertThat(n.getEnd()).isEqualTo(1);
        assertThat(n.getValue()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Ambiguous separators should yield no numeral")
    void testAmbiguous() {
        assertThat(scan("1,23", 0)).isNull();
        assertThat(scan("1,2345", 0)).isNull();
        assertThat(scan("1.2.3", 0)).isNull();
        assertThat(scan("1.5,000", 0)).isNull();
    }

    @Test
    @DisplayName("Should only start at a run boundary")
    void testRunBoundary() {
        assertThat(scan("123", 1)).isNull();
        assertThat(scan("1,234", 2)).isNull();
        assertThat(scan("a12", 1)).isNotNull();
    }

    @Test
    @DisplayName("Should read other digit systems and stop at a change of system")
    void testDigitSystems() {
        NumericRecognizer.Numeral arabic = scan("١٢٣", 0);
        assertThat(arabic.getValue()).isEqualTo(123.0);
        assertThat(arabic.getText()).isEqualTo("123");

        NumericRecognizer.Numeral devanagari = scan("१०", 0);
        assertThat(devanagari.getValue()).isEqualTo(10.0);

        NumericRecognizer.Numeral mixed = scan("1٢", 0);
        assertThat(mixed.getEnd()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should compose CJK numerals")
    void testCjkNumerals() {
        assertThat(scan("二十三", 0).getValue()).isEqualTo(23.0);
        assertThat(scan("十五", 0).getValue()).isEqualTo(15.0);
        assertThat(scan("三百五十", 0).getValue()).isEqualTo(350.0);
        assertThat(scan("一百零五", 0).getValue()).isEqualTo(105.0);
        assertThat(scan("一万二千", 0).getValue()).isEqualTo(12000.0);
        assertThat(scan("一九八四年", 0).getValue()).isEqualTo(1984.0);
        assertThat(scan("一九八四年", 0).getEnd()).isEqualTo(4);
        assertThat(scan("二十三", 0).getText()).isEqualTo("23");
        assertThat(scan("一万零五", 0).getText()).isEqualTo("10005");
    }

    @Test
    @DisplayName("Long positional CJK runs should keep every digit")
    void testLongPositionalCjk() {
        StringBuilder nines = new StringBuilder();
        for (int i = 0; i < 20; i++) nines.append('九');

        NumericRecognizer.Numeral n = scan(nines.toString(), 0);

        assertThat(n.getEnd()).isEqualTo(20);
        assertThat(n.getText()).isEqualTo("99999999999999999999");
        assertThat(n.getValue()).isEqualTo(1e20);
    }

    @Test
    @DisplayName("Should refuse CJK numeral runs that cannot be composed unambiguously")
    void testAmbiguousCjk() {
        assertThat(scan("万", 0)).isNull();
        assertThat(scan("二百五", 0)).isNull();
        assertThat(scan("十百", 0)).isNull();
        assertThat(scan("一万五", 0)).isNull();
        assertThat(scan("三万二", 0)).isNull();
        assertThat(scan("一万二千五", 0)).isNull();
        assertThat(scan("二十三", 1)).isNull();
    }

    @Test
    @DisplayName("Non-numeric text yields nothing")
    void testNoNumber() {
        assertThat(scan("abc", 0)).isNull();
        assertThat(scan("-x", 0)).isNull();
    }
}
