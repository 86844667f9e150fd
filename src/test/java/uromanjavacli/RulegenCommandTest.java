package uromanjavacli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import uromanjava.RuleSet;
import uromanjava.RuleStore;
import uromanjava.Uroman;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class RulegenCommandTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write a snapshot equivalent to the rule files")
    void testGenerateSnapshot() throws Exception {
        Path out = tempDir.resolve("rule_store.json");

        int exit = new CommandLine(new RulegenCommand()).execute("-o", out.toString());

        assertThat(exit).isZero();
        assertThat(Files.exists(out)).isTrue();

        RuleStore expected = RuleStore.fromRules();
        RuleStore loaded = RuleStore.fromJson(out.toFile());
        assertThat(loaded.ruleCount()).isEqualTo(expected.ruleCount());
        assertThat(loaded.getRuleSets()).extracting(RuleSet::getId)
                .containsExactlyElementsOf(expected.getRuleSets().stream().map(RuleSet::getId)
                        .collect(Collectors.toList()));
        assertThat(new Uroman(loaded).romanizeString("こんにちは")).isEqualTo("kon'nichiha");
    }
}
