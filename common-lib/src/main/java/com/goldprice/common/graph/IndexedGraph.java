package com.goldprice.common.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Read-only view over a deduplicated state payload: a flat array in which
 * objects and arrays hold integer positions of other entries instead of
 * inline values.
 *
 * <p><strong>Addressing:</strong>
 * <ul>
 *   <li>An object field or array element is a position into the same array.</li>
 *   <li>{@code ["Reactive", i]}, {@code ["ShallowReactive", i]}, {@code ["Ref", i]} and
 *       {@code ["ShallowRef", i]} are transparent wrappers around position {@code i}.</li>
 *   <li>{@code ["Date", "..."]} stands for the date string it carries.</li>
 *   <li>Negative positions are sentinels (undefined, holes) and resolve to nothing.</li>
 * </ul>
 *
 * <p>Every accessor returns {@code null} for anything it cannot resolve and never
 * throws, so one malformed entry cannot abort the walk over its siblings.
 * Wrapper chains are followed at most {@link #MAX_HOPS} times.
 */
public final class IndexedGraph {

    public static final int MAX_HOPS = 4;

    private static final Set<String> REFERENCE_WRAPPERS =
        Set.of("Reactive", "ShallowReactive", "Ref", "ShallowRef");
    private static final String DATE_WRAPPER = "Date";

    private final ArrayNode store;

    public IndexedGraph(ArrayNode store) {
        this.store = store;
    }

    public int size() {
        return store.size();
    }

    /** The entry the payload is rooted at, position 0. */
    public JsonNode root() {
        return resolve(0);
    }

    /**
     * Returns the value stored at {@code position}, unwrapping typed wrappers.
     *
     * @return the resolved node, or {@code null} when the position is out of
     *         bounds or the wrapper chain is broken or too long
     */
    public JsonNode resolve(int position) {
        if (position < 0 || position >= store.size()) return null;

        JsonNode node = store.get(position);
        for (int hops = 0; isWrapper(node); hops++) {
            String tag = node.get(0).textValue();
            if (DATE_WRAPPER.equals(tag)) {
                JsonNode value = node.get(1);
                return value.isTextual() ? value : null;
            }
            if (hops >= MAX_HOPS) return null;

            JsonNode next = node.get(1);
            if (!isPosition(next)) return null;
            int target = next.intValue();
            if (target < 0 || target >= store.size()) return null;
            node = store.get(target);
        }
        return node;
    }

    /**
     * Dereferences a node that is expected to hold a position.
     */
    public JsonNode resolve(JsonNode reference) {
        return isPosition(reference) ? resolve(reference.intValue()) : null;
    }

    /**
     * Reads {@code name} from an object entry and resolves the position stored there.
     */
    public JsonNode field(JsonNode holder, String name) {
        if (holder == null || !holder.isObject()) return null;
        return resolve(holder.get(name));
    }

    /**
     * Walks a fixed chain of field names starting at {@code from}.
     */
    public JsonNode path(JsonNode from, List<String> names) {
        JsonNode current = from;
        for (String name : names) {
            current = field(current, name);
            if (current == null) return null;
        }
        return current;
    }

    // ── literal readers ──────────────────────────────────────────────────────

    /**
     * Text of a string or number literal; {@code null} for anything else or a blank string.
     */
    public static String text(JsonNode node) {
        if (node == null) return null;
        if (node.isTextual()) {
            String value = node.textValue().trim();
            return value.isEmpty() ? null : value;
        }
        if (node.isNumber()) return node.asText();
        return null;
    }

    /**
     * Numeric value of a number literal or a numeric string; a comma is read as
     * the decimal separator. {@code null} for anything malformed.
     */
    public static BigDecimal decimal(JsonNode node) {
        if (node == null) return null;
        if (node.isNumber()) return node.decimalValue();
        if (!node.isTextual()) return null;

        String value = node.textValue().trim().replace(',', '.');
        if (value.isEmpty()) return null;
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isPosition(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToInt();
    }

    private static boolean isWrapper(JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 2) return false;
        JsonNode tag = node.get(0);
        return tag.isTextual()
            && (REFERENCE_WRAPPERS.contains(tag.textValue()) || DATE_WRAPPER.equals(tag.textValue()));
    }
}
