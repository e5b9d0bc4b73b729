package org.javai.resilience.boundary;

import org.javai.resilience.ClassifiedError;
import org.javai.resilience.ErrorJson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What the transport layer sends back for a failed request.
 *
 * @param status The transport status, taken from the error's taxonomy entry
 * @param body The public or verbose rendering of the error
 * @param error The classified error the response was built from
 */
public record ErrorResponse(int status, Map<String, Object> body, ClassifiedError error) {

    public ErrorResponse {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(error, "error must not be null");
        body = Collections.unmodifiableMap(new LinkedHashMap<>(body));
    }

    public String correlationId() {
        return error.correlationId();
    }

    public String toJson() {
        return ErrorJson.write(body);
    }
}
