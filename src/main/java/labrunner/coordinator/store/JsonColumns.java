package labrunner.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import labrunner.coordinator.model.TaskSlice;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON encoding of collection-valued columns.
 */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<TaskSlice>> SLICE_LIST = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to encode column value", e);
        }
    }

    static List<String> readStringList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to decode string list: " + json, e);
        }
    }

    static Set<String> readStringSet(String json) {
        return new LinkedHashSet<>(readStringList(json));
    }

    static List<TaskSlice> readSlices(String json) {
        try {
            return MAPPER.readValue(json, SLICE_LIST);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to decode task slices", e);
        }
    }
}
