package org.javai.resilience;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * Shared JSON serialisation for rendered errors and structured log records.
 */
public final class ErrorJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ErrorJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serialises a rendered view.
     *
     * @throws IllegalArgumentException if the view cannot be serialised at all
     */
    public static String write(Map<String, ?> view) {
        try {
            return MAPPER.writeValueAsString(view);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise view: " + e.getOriginalMessage(), e);
        }
    }
}
