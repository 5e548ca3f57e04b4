package com.ryuqq.integrity.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.integrity.core.json.JsonMappers;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Deterministic JSON canonicalization.
 *
 * <p>Object keys are sorted recursively at every nesting level, array order is preserved
 * and the output is compact (no insignificant whitespace). The result depends only on the
 * JSON value, never on the insertion order of keys or on how a store happens to lay out
 * its JSON columns.</p>
 *
 * <p><strong>Properties:</strong></p>
 * <ul>
 *   <li>{@code canonicalize({a:1,b:2}) == canonicalize({b:2,a:1})}</li>
 *   <li>Idempotent: canonicalizing a parsed canonical string yields the same string</li>
 * </ul>
 *
 * @author Integrity Team
 * @since 1.0.0
 */
public final class CanonicalJson {

    private CanonicalJson() {
    }

    /**
     * Canonical string form of a JSON value.
     *
     * @param node the JSON value
     * @return compact, key-sorted JSON text
     * @throws IllegalArgumentException if node is null
     */
    public static String canonicalize(JsonNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        try {
            return JsonMappers.shared().writeValueAsString(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical JSON", e);
        }
    }

    /**
     * UTF-8 bytes of the canonical form.
     *
     * @param node the JSON value
     * @return canonical bytes
     */
    public static byte[] canonicalBytes(JsonNode node) {
        return canonicalize(node).getBytes(StandardCharsets.UTF_8);
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            Collections.sort(names);
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                out.set(name, sorted(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                out.add(sorted(element));
            }
            return out;
        }
        return node;
    }
}
