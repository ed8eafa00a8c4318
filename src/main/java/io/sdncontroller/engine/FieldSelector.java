package io.sdncontroller.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects a record onto a subset of its fields, keyed by their wire names.
 * Requested fields the record does not carry map to null.
 */
final class FieldSelector {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private FieldSelector() {
    }

    static Map<String, Object> select(Object record, List<String> fields) {
        Map<String, Object> all = MAPPER.convertValue(record, MAP_TYPE);
        if (fields == null || fields.isEmpty()) {
            return all;
        }
        Map<String, Object> selected = new LinkedHashMap<>();
        for (String field : fields) {
            selected.put(field, all.get(field));
        }
        return selected;
    }
}
