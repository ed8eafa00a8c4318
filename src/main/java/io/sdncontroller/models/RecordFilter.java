package io.sdncontroller.models;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-equality filter for bulk reads: a record matches when, for every
 * filtered field, its value is one of the listed values.
 */
public final class RecordFilter {

    private static final RecordFilter NONE = new RecordFilter(Map.of());

    private final Map<String, List<String>> fields;

    private RecordFilter(Map<String, List<String>> fields) {
        this.fields = fields;
    }

    public static RecordFilter none() {
        return NONE;
    }

    public static RecordFilter of(Map<String, ? extends Collection<String>> fields) {
        if (fields == null || fields.isEmpty()) {
            return NONE;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        fields.forEach((field, values) -> {
            if (values != null && !values.isEmpty()) {
                copy.put(field, List.copyOf(values));
            }
        });
        return new RecordFilter(Collections.unmodifiableMap(copy));
    }

    public static RecordFilter by(String field, String... values) {
        return of(Map.of(field, List.of(values)));
    }

    public List<String> values(String field) {
        return fields.getOrDefault(field, List.of());
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public boolean matches(String field, String value) {
        List<String> accepted = fields.get(field);
        return accepted == null || (value != null && accepted.contains(value));
    }

    public Map<String, List<String>> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "RecordFilter" + fields;
    }
}
