package uromanjava;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.Character.UnicodeScript;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class ScriptResolverTest {

    private static RuleStore store;

    @BeforeAll
    static void loadStore() {
        store = Uroman.RuleStoreHolder.get();
    }

    private static List<String> ids(List<RuleSet> sets) {
        return sets.stream().map(RuleSet::getId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should pick script rule sets in order of first appearance, then generic")
    void testScriptDetection() {
        ScriptResolver resolver = new ScriptResolver(store, false);

        assertThat(ids(resolver.resolve(null, "Привет"))).containsExactly("Cyrl", "generic");
        assertThat(ids(resolver.resolve(null, "abc こんにちは Привет"))).containsExactly("Hira", "Cyrl", "generic");
        assertThat(ids(resolver.resolve(null, "hello, world"))).containsExactly("generic");
        assertThat(ids(resolver.resolve(null, ""))).containsExactly("generic");
    }

    @Test
    @DisplayName("Should put an explicit language rule set and its parent first")
    void testLanguageFirst() {
        ScriptResolver resolver = new ScriptResolver(store, false);

        assertThat(ids(resolver.resolve("ukr", "Київ"))).containsExactly("ukr", "Cyrl", "generic");
        assertThat(ids(resolver.resolve(" JPN ", "世界"))).containsExactly("jpn", "Hani", "generic");
        // parent applies even when its script is absent
        assertThat(ids(resolver.resolve("fas", "abc"))).containsExactly("fas", "Arab", "generic");
    }

    @Test
    @DisplayName("Should fall back to script detection for codes without a rule set")
    void testUnknownCodeLenient() {
        ScriptResolver resolver = new ScriptResolver(store, false);

        assertThat(ids(resolver.resolve("xxq", "Привет"))).containsExactly("Cyrl", "generic");
        assertThat(ids(resolver.resolve("ara", "مرحبا"))).containsExactly("Arab", "generic");
        assertThat(ids(resolver.resolve("  ", "Привет"))).containsExactly("Cyrl", "generic");
    }

    @Test
    @DisplayName("Strict mode should reject unregistered codes but accept registered ones")
    void testStrict() {
        ScriptResolver resolver = new ScriptResolver(store, true);

        assertThatThrownBy(() -> resolver.resolve("xxq", "Привет"))
                .isInstanceOf(UnknownLanguageCodeException.class)
                .hasMessageContaining("xxq");
        assertThat(ids(resolver.resolve("ara", "مرحبا"))).containsExactly("Arab", "generic");
        assertThat(ids(resolver.resolve(null, "Привет"))).containsExactly("Cyrl", "generic");
        assertThat(resolver.checkLanguageCode(" ARA ")).isEqualTo("ara");
        assertThat(resolver.checkLanguageCode("")).isNull();
        assertThatThrownBy(() -> resolver.checkLanguageCode("xxq"))
                .isInstanceOf(UnknownLanguageCodeException.class);
        assertThat(new ScriptResolver(store, false).checkLanguageCode("xxq")).isEqualTo("xxq");
    }

    @Test
    @DisplayName("Should ignore common and inherited code points when detecting scripts")
    void testDetectScripts() {
        assertThat(ScriptResolver.detectScripts("123 Γειά, мир!"))
                .containsExactly(UnicodeScript.GREEK, UnicodeScript.CYRILLIC);
    }
}
