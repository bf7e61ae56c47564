package batchflow.engine.store;

import batchflow.engine.util.JsonValues;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of the opaque job columns (arguments, results, id lists).
 */
final class JsonColumns {

    private static final Logger log = LoggerFactory.getLogger(JsonColumns.class);

    private static final ObjectMapper MAPPER = JsonValues.mapper();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    static String writeMap(Map<String, Object> map) throws JsonProcessingException {
        return MAPPER.writeValueAsString(map);
    }

    static Map<String, Object> readMap(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        return MAPPER.readValue(json, MAP_TYPE);
    }

    static String writeList(List<String> list) throws JsonProcessingException {
        return MAPPER.writeValueAsString(list);
    }

    static List<String> readList(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return MAPPER.readValue(json, LIST_TYPE);
    }

    /**
     * Encode a task result. Values Jackson cannot serialize are stored as
     * their string form.
     */
    static String writeResult(Object result) {
        if (result == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Result of type {} is not JSON serializable, storing its string form: {}",
                    result.getClass().getName(), e.getOriginalMessage());
            return writeString(String.valueOf(result));
        }
    }

    static Object readResult(String json) throws JsonProcessingException {
        if (json == null) {
            return null;
        }
        return MAPPER.readValue(json, Object.class);
    }

    private static String writeString(String value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("String encoding failed", e);
        }
    }
}
