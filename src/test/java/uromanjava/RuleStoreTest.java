package uromanjava;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.lang.Character.UnicodeScript;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class RuleStoreTest {

    private static RuleStore store;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadStore() {
        store = RuleStore.fromRules();
    }

    private void write(String name, String content) throws IOException {
        Files.write(tempDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    private void writeValidDirectory() throws IOException {
        write("rulesets.json", "[{\"id\": \"Latn\", \"kind\": \"script\", \"file\": \"latin.txt\", \"scripts\": [\"LATIN\"]},"
                + " {\"id\": \"generic\", \"kind\": \"generic\", \"file\": \"generic.txt\"}]");
        write("latin.txt", "sh\tS\n");
        write("generic.txt", "# nothing explicit\n");
        write("languages.tsv", "eng\tEnglish\n");
    }

    @Test
    @DisplayName("Should load the bundled rule directory")
    void testBundledRules() {
        assertThat(store.getGeneric().getId()).isEqualTo("generic");
        assertThat(store.languageRuleSet("jpn")).isNotNull();
        assertThat(store.languageRuleSet("Cyrl")).isNull();
        assertThat(store.scriptRuleSets(UnicodeScript.CYRILLIC))
                .extracting(RuleSet::getId).containsExactly("Cyrl");
        assertThat(store.scriptRuleSets(UnicodeScript.LATIN)).isEmpty();
        assertThat(store.getRuleSet("ukr").getParent()).isEqualTo("Cyrl");
        assertThat(store.getLanguages().isKnown("ara")).isTrue();
        assertThat(store.getLanguages().nameOf("jpn")).isEqualTo("Japanese");
        assertThat(store.ruleCount()).isGreaterThan(500);
    }

    @Test
    @DisplayName("Should number rules in manifest order and file order")
    void testRegistrationOrder() {
        int previous = -1;
        for (RuleSet rs : store.getRuleSets()) {
            for (Rule r : rs.getRules()) {
                assertThat(r.getOrder()).isGreaterThan(previous);
                previous = r.getOrder();
            }
        }
    }

    @Test
    @DisplayName("Should derive generic rules for accented Latin letters and full-width forms")
    void testDerivedRules() {
        RuleSet generic = store.getGeneric();

        assertThat(generic.lookup("é")).extracting(r -> r.getTargets().get(0)).containsExactly("e");
        assertThat(generic.lookup("Š")).extracting(r -> r.getTargets().get(0)).containsExactly("S");
        assertThat(generic.lookup("Ａ")).extracting(r -> r.getTargets().get(0)).containsExactly("A");
        assertThat(generic.lookup("ß")).extracting(r -> r.getTargets().get(0)).containsExactly("ss");
    }

    @Test
    @DisplayName("Derived rules should not shadow explicit ones")
    void testDerivedRulesKeepExplicit() {
        Rule explicit = new Rule("é", Collections.singletonList("E"), 1.0, null, null, 0);

        RuleSet generic = RuleFixtures.genericSet(DerivedRules.extend(Collections.singletonList(explicit), 1)
                .toArray(new Rule[0]));

        assertThat(generic.lookup("é")).containsExactly(explicit);
        assertThat(generic.lookup("è")).hasSize(1);
    }

    @Test
    @DisplayName("Should load a rule directory from the file system")
    void testFileSystemDirectory() throws IOException {
        writeValidDirectory();

        RuleStore custom = RuleStore.fromRules(tempDir.toString());

        assertThat(custom.getRuleSets()).extracting(RuleSet::getId).containsExactly("Latn", "generic");
        assertThat(custom.getRuleSet("Latn").lookup("sh")).hasSize(1);
        assertThat(custom.getLanguages().asMap()).containsEntry("eng", "English");
    }

    @Test
    @DisplayName("Should fail fast on a malformed rule file")
    void testMalformedRuleFile() throws IOException {
        writeValidDirectory();
        write("latin.txt", "sh\tS\nbroken line\n");

        assertThatThrownBy(() -> RuleStore.fromRules(tempDir.toString()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("latin.txt:2");
    }

    @Test
    @DisplayName("Should fail fast on a missing rule file")
    void testMissingRuleFile() throws IOException {
        writeValidDirectory();
        Files.delete(tempDir.resolve("latin.txt"));

        assertThatThrownBy(() -> RuleStore.fromRules(tempDir.toString()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("Latn");
    }

    @Test
    @DisplayName("Should reject unknown kinds, scripts, properties and parents in the manifest")
    void testMalformedManifest() throws IOException {
        writeValidDirectory();

        write("rulesets.json", "[{\"id\": \"Latn\", \"kind\": \"alphabet\", \"file\": \"latin.txt\"}]");
        assertThatThrownBy(() -> RuleStore.fromRules(tempDir.toString()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("unknown kind");

        write("rulesets.json", "[{\"id\": \"Latn\", \"kind\": \"script\", \"file\": \"latin.txt\", \"scripts\": [\"KLINGON\"]}]");
        assertThatThrownBy(() -> RuleStore.fromRules(tempDir.toString()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("unknown script");

        write("rulesets.json", "[{\"id\": \"Latn\", \"kind\": \"script\", \"file\": \"latin.txt\", \"priority\": 1}]");
        assertThatThrownBy(() -> RuleStore.fromRules(tempDir.toString()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("manifest");

        write("rulesets.json", "[{\"id\": \"eng\", \"kind\": \"language\", \"file\": \"latin.txt\", \"parent\": \"Nope\"},"
                + " {\"id\": \"generic\", \"kind\": \"generic\", \"file\": \"generic.txt\"}]");
        assertThatThrownBy(() -> RuleStore.fromRules(tempDir.toString()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("unknown parent");
    }

    @Test
    @DisplayName("Should require exactly one generic rule set and unique ids")
    void testStoreValidation() {
        RuleSet a = RuleFixtures.scriptSet("Latn");

        assertThatThrownBy(() -> new RuleStore(RuleFixtures.sets(a), LanguageRegistry.empty()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("No generic");

        assertThatThrownBy(() -> new RuleStore(RuleFixtures.sets(a, a, RuleFixtures.genericSet()), LanguageRegistry.empty()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("Duplicate");

        RuleSet secondGeneric = new RuleSet("generic2", RuleSet.Kind.GENERIC, Collections.emptyList(), null,
                Collections.emptyList());
        assertThatThrownBy(() -> new RuleStore(
                RuleFixtures.sets(RuleFixtures.genericSet(), secondGeneric), LanguageRegistry.empty()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("More than one generic");
    }

    @Test
    @DisplayName("Should reject malformed language registry lines")
    void testMalformedLanguages() throws IOException {
        writeValidDirectory();
        write("languages.tsv", "eng\tEnglish\nEnglish\n");

        assertThatThrownBy(() -> RuleStore.fromRules(tempDir.toString()))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("languages.tsv:2");
    }

    @Test
    @DisplayName("Should reload an identical store from its JSON snapshot")
    void testSnapshot() throws IOException {
        Path json = tempDir.resolve(RuleStoreSnapshot.FILE_NAME);

        store.serializeToJson(json.toString());
        RuleStore reloaded = RuleStore.fromJson(json.toString());

        assertThat(reloaded.getRuleSets()).extracting(RuleSet::getId)
                .containsExactlyElementsOf(store.getRuleSets().stream().map(RuleSet::getId).collect(Collectors.toList()));
        assertThat(reloaded.ruleCount()).isEqualTo(store.ruleCount());
        assertThat(reloaded.getLanguages().asMap()).isEqualTo(store.getLanguages().asMap());
        assertThat(reloaded.getRuleSet("Hira").getRules()).isEqualTo(store.getRuleSet("Hira").getRules());

        Uroman fromSnapshot = new Uroman(reloaded);
        assertThat(fromSnapshot.romanizeString("こんにちは")).isEqualTo("kon'nichiha");
    }

    private static RuleStore fromJsonText(String json) throws IOException {
        return RuleStore.fromJson(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should reject structurally malformed snapshots")
    void testMalformedSnapshot() {
        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":null}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("no rule sets");

        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"kind\":\"generic\"}]}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("without id");

        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"id\":\"generic\",\"kind\":\"generic\",\"rules\":null}]}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("generic has no rule list");

        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"id\":\"generic\",\"kind\":\"generic\","
                + "\"rules\":[[\"a\",null,1.0,null,null,0]]}]}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("incomplete rule");

        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"id\":\"generic\",\"kind\":\"generic\","
                + "\"rules\":[[null,[\"A\"],1.0,null,null,0]]}]}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("invalid rule");
    }

    @Test
    @DisplayName("Snapshots should pass the same declaration checks as rule directories")
    void testSnapshotDeclarations() {
        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"id\":\"English\",\"kind\":\"language\",\"rules\":[]},"
                + "{\"id\":\"generic\",\"kind\":\"generic\",\"rules\":[]}]}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("ISO 639-3");

        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"id\":\"generic\",\"kind\":\"alphabet\",\"rules\":[]}]}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("unknown kind");

        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"id\":\"Latn\",\"kind\":\"script\",\"scripts\":[\"KLINGON\"],"
                + "\"rules\":[]}]}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("unknown script");

        assertThatThrownBy(() -> fromJsonText("{\"ruleSets\":[{\"id\":\"generic\",\"kind\":\"generic\",\"rules\":[]}],"
                + "\"languages\":null}"))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("language registry");
    }
}
