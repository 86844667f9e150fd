package uromanjavacli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class RomanizeCommandTest {

    @TempDir
    Path tempDir;

    private static int run(String... args) {
        return new CommandLine(new RomanizeCommand()).execute(args);
    }

    @Test
    @DisplayName("Should romanize positional text into the output file")
    void testPositionalText() throws IOException {
        Path out = tempDir.resolve("out.txt");

        int exit = run("-o", out.toString(), "Привет", "Мир");

        assertThat(exit).isZero();
        assertThat(new String(Files.readAllBytes(out), StandardCharsets.UTF_8)).isEqualTo("Privet Mir\n");
    }

    @Test
    @DisplayName("Should honour language code, format and line limit for file input")
    void testFileInput() throws IOException {
        Path in = tempDir.resolve("in.txt");
        Files.write(in, Arrays.asList("世界", "東京", "京都"), StandardCharsets.UTF_8);
        Path out = tempDir.resolve("out.jsonl");

        int exit = run("-i", in.toString(), "-o", out.toString(), "-l", "jpn", "-f", "edges", "--max-lines", "2");

        assertThat(exit).isZero();
        assertThat(Files.readAllLines(out, StandardCharsets.UTF_8)).containsExactly(
                "[{\"start\":0,\"end\":2,\"text\":\"sekai\",\"edge_type\":\"lang-rule\",\"is_numeric\":false,"
                        + "\"value\":null,\"orig_text\":null}]",
                "[{\"start\":0,\"end\":2,\"text\":\"toukyou\",\"edge_type\":\"lang-rule\",\"is_numeric\":false,"
                        + "\"value\":null,\"orig_text\":null}]");
    }

    @Test
    @DisplayName("Should decode escapes when asked to")
    void testDecodeUnicode() throws IOException {
        Path in = tempDir.resolve("escaped.txt");
        Files.write(in, Arrays.asList("caf\\u00e9"), StandardCharsets.UTF_8);
        Path out = tempDir.resolve("out.txt");

        assertThat(run("-i", in.toString(), "-o", out.toString(), "--decode-unicode")).isZero();
        assertThat(Files.readAllLines(out, StandardCharsets.UTF_8)).containsExactly("cafe");
    }
}
