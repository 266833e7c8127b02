package io.mydata.core.schema;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared Jackson mapper for JSON import and export of resources. */
final class ResourceJson {

    static final ObjectMapper MAPPER = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ResourceJson() {}

    /** Converts a serializable view to a JSON tree; {@code java.time} values become ISO-8601 text. */
    static ObjectNode toTree(Map<String, Object> view) {
        return MAPPER.valueToTree(jsonSafe(view));
    }

    private static Object jsonSafe(Object value) {
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, jsonSafe(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(jsonSafe(v)));
            return copy;
        }
        return value;
    }
}
