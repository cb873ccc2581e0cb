package com.stealthprompt.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stable JSON rendering: object keys sorted at every depth, array order kept.
 */
public final class JsonCanonicalizer {
    private JsonCanonicalizer() {}

    public static JsonNode normalize(ObjectMapper mapper, JsonNode node) {
        if (node == null || node.isNull()) return NullNode.getInstance();

        if (node.isObject()) {
            ObjectNode dst = mapper.createObjectNode();
            List<String> fields = new ArrayList<>();
            node.fieldNames().forEachRemaining(fields::add);
            Collections.sort(fields);
            for (String f : fields) {
                dst.set(f, normalize(mapper, node.get(f)));
            }
            return dst;
        }
        if (node.isArray()) {
            ArrayNode arr = mapper.createArrayNode();
            for (JsonNode it : node) arr.add(normalize(mapper, it));
            return arr;
        }
        return node;
    }

    public static String canonicalize(ObjectMapper mapper, Object value) {
        JsonNode node = (value instanceof JsonNode j) ? j : mapper.valueToTree(value);
        try {
            return mapper.writeValueAsString(normalize(mapper, node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render canonical JSON", e);
        }
    }
}
