package uromanjava;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Small hand-built rule sets for engine tests.
 */
final class RuleFixtures {
    private static int nextOrder;

    private RuleFixtures() {
    }

    static Rule rule(String source, String... targets) {
        return new Rule(source, Arrays.asList(targets), 1.0, null, null, nextOrder++);
    }

    static Rule rule(String source, double cost, String... targets) {
        return new Rule(source, Arrays.asList(targets), cost, null, null, nextOrder++);
    }

    static Rule contextual(String source, String target, String left, String right, double cost) {
        return new Rule(source, Collections.singletonList(target), cost, left, right, nextOrder++);
    }

    static RuleSet scriptSet(String id, Rule... rules) {
        return new RuleSet(id, RuleSet.Kind.SCRIPT,
                Collections.singletonList(Character.UnicodeScript.LATIN), null, Arrays.asList(rules));
    }

    static RuleSet languageSet(String id, Rule... rules) {
        return new RuleSet(id, RuleSet.Kind.LANGUAGE, Collections.emptyList(), null, Arrays.asList(rules));
    }

    static RuleSet genericSet(Rule... rules) {
        return new RuleSet("generic", RuleSet.Kind.GENERIC, Collections.emptyList(), null, Arrays.asList(rules));
    }

    static List<RuleSet> sets(RuleSet... sets) {
        return new ArrayList<>(Arrays.asList(sets));
    }
}
