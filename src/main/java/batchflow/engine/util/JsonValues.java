package batchflow.engine.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON mapper for stored job data (arguments, metadata, results).
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .findAndRegisterModules();

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonValues() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Copy of {@code map} holding the values a store round trip gives back:
     * whole numbers as Integer or Long by magnitude, decimals as Double,
     * temporals as ISO strings, nested objects as maps and lists.
     *
     * @param what name of the map for the error message
     * @throws IllegalArgumentException if a value cannot be written as JSON
     */
    public static Map<String, Object> normalize(Map<String, Object> map, String what) {
        if (map == null || map.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(MAPPER.writeValueAsString(map), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(what + " must be JSON serializable: " + e.getOriginalMessage(), e);
        }
    }
}
