package uk.gegc.coursesync.shared.hash;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Keys a structured value by the SHA-256 of its canonical JSON form: object keys sorted,
 * strings trimmed, array order kept. An optional normalizer runs before serialization.
 *
 * @param <T> type of value being keyed
 */
public class CanonicalJsonDigester<T> implements ContentDigester<T> {

    private final ObjectMapper objectMapper;
    private final Function<T, Object> normalizer;
    private final int keyLength;

    public CanonicalJsonDigester(ObjectMapper objectMapper, Function<T, Object> normalizer, int keyLength) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        this.keyLength = keyLength;
    }

    public CanonicalJsonDigester(ObjectMapper objectMapper, int keyLength) {
        this(objectMapper, value -> value, keyLength);
    }

    @Override
    public String digest(T value) {
        return Digests.sha256Hex(canonicalJson(value)).substring(0, keyLength);
    }

    public String canonicalJson(T value) {
        Object normalized = value == null ? null : normalizer.apply(value);
        JsonNode tree = normalized == null ? NullNode.getInstance() : objectMapper.valueToTree(normalized);
        try {
            return objectMapper.writeValueAsString(canonicalize(tree));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize canonical JSON", ex);
        }
    }

    private JsonNode canonicalize(JsonNode node) {
        if (node == null || node.isNull()) {
            return NullNode.getInstance();
        }
        if (node.isObject()) {
            ObjectNode sorted = objectMapper.createObjectNode();
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            names.sort(Comparator.naturalOrder());
            for (String name : names) {
                JsonNode child = node.get(name);
                if (child != null && !child.isNull()) {
                    sorted.set(name, canonicalize(child));
                }
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            node.forEach(item -> array.add(canonicalize(item)));
            return array;
        }
        if (node.isTextual()) {
            return TextNode.valueOf(node.asText().trim());
        }
        return node;
    }
}
