package uromanjava;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * JSON rendering of the edge-based views, one array per line.
 *
 * <pre>{@code
 * [{"start":0,"end":3,"text":"123","edge_type":"numeric","is_numeric":true,"value":123.0,"orig_text":"123"},
 *  {"start":3,"end":4,"text":" ","edge_type":"whitespace","is_numeric":false,"value":null,"orig_text":null}]
 * }</pre>
 */
public final class EdgeJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EdgeJson() {
    }

    /**
     * Converts one edge to a JSON object.
     *
     * @param edge the edge
     * @return {@code start}, {@code end}, {@code text}, {@code edge_type},
     * {@code is_numeric}, {@code value} and {@code orig_text}; the last two are
     * {@code null} unless the edge is numeric
     */
    public static ObjectNode toNode(Edge edge) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("start", edge.getStart());
        node.put("end", edge.getEnd());
        node.put("text", edge.getText());
        node.put("edge_type", edge.getEdgeType());
        node.put("is_numeric", edge.isNumeric());
        // null for non-numeric edges
        node.put("value", edge.getValue());
        node.put("orig_text", edge.getOrigText());
        return node;
    }

    /**
     * Converts an edge list to a JSON array.
     */
    public static ArrayNode toArray(List<Edge> edges) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (Edge e : edges) arr.add(toNode(e));
        return arr;
    }

    /**
     * Converts annotated edges to a JSON array; each object gets an
     * {@code alternates} array.
     */
    public static ArrayNode toAnnotatedArray(List<AnnotatedEdge> edges) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (AnnotatedEdge a : edges) {
            ObjectNode node = toNode(a.getEdge());
            node.set("alternates", toArray(a.getAlternates()));
            arr.add(node);
        }
        return arr;
    }

    /**
     * Renders a result as a compact single-line JSON string. A {@code str}
     * result renders as a JSON string literal.
     *
     * @param result a projected result
     * @return the JSON text
     */
    public static String toJson(RomanizationResult result) {
        try {
            switch (result.getFormat()) {
                case STR:
                    return MAPPER.writeValueAsString(result.getText());
                case ALTS:
                    return MAPPER.writeValueAsString(toAnnotatedArray(result.getAnnotatedEdges()));
                default:
                    return MAPPER.writeValueAsString(toArray(result.getEdges()));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render edges as JSON", e);
        }
    }
}
