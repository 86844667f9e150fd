package uromanjava;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON-serialized form of a complete {@link RuleStore} ({@code rule_store.json}).
 *
 * <p>The snapshot already contains derived rules, so loading it skips rule
 * file parsing and rule derivation entirely. Rules are stored as compact
 * arrays: {@code [source, targets, cost, left, right, order]}.</p>
 */
public class RuleStoreSnapshot {
    /**
     * Snapshot file name.
     */
    public static final String FILE_NAME = "rule_store.json";

    /**
     * Format version; bumped whenever the layout changes.
     */
    public int version = 1;

    /**
     * Rule sets in resolver-independent declaration order.
     */
    public List<RuleSetData> ruleSets = new ArrayList<>();

    /**
     * Language registry, code → English name.
     */
    public Map<String, String> languages = new LinkedHashMap<>();

    /**
     * Constructs an empty snapshot (for deserialization).
     */
    public RuleStoreSnapshot() {
    }

    /**
     * Serialized rule set.
     */
    public static class RuleSetData {
        public String id;
        public String kind;
        public List<String> scripts = new ArrayList<>();
        public String parent;
        public List<RuleData> rules = new ArrayList<>();

        public RuleSetData() {
        }
    }

    /**
     * Serialized rule, written as a JSON array.
     */
    @JsonFormat(shape = JsonFormat.Shape.ARRAY)
    @JsonPropertyOrder({"source", "targets", "cost", "left", "right", "order"})
    public static class RuleData {
        public String source;
        public List<String> targets = new ArrayList<>();
        public double cost;
        public String left;
        public String right;
        public int order;

        public RuleData() {
        }

        RuleData(Rule r) {
            this.source = r.getSource();
            this.targets = new ArrayList<>(r.getTargets());
            this.cost = r.getCost();
            this.left = r.getLeft();
            this.right = r.getRight();
            this.order = r.getOrder();
        }

        Rule toRule() {
            return new Rule(source, targets, cost, left, right, order);
        }
    }
}
