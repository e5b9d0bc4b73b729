package org.javai.resilience.classify;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the caller knows about the operation that failed. The classifier copies these
 * values into the metadata of the error it produces. All fields may be null.
 *
 * @param operation The operation being performed (e.g. {@code "SpecStore.save"})
 * @param field The input field involved, for validation failures
 * @param resource The kind of resource being accessed
 * @param id The identifier of the resource
 * @param action The action attempted on the resource
 * @param endpoint The endpoint being served or called
 * @param path A file or request path
 */
public record ClassificationContext(
        String operation,
        String field,
        String resource,
        Object id,
        String action,
        String endpoint,
        String path
) {

    private static final ClassificationContext EMPTY = new ClassificationContext(
            null, null, null, null, null, null, null);

    public static ClassificationContext empty() {
        return EMPTY;
    }

    public static ClassificationContext forOperation(String operation) {
        return builder().operation(operation).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The non-null values as a map, for logging.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "operation", operation);
        putIfPresent(map, "field", field);
        putIfPresent(map, "resource", resource);
        putIfPresent(map, "id", id);
        putIfPresent(map, "action", action);
        putIfPresent(map, "endpoint", endpoint);
        putIfPresent(map, "path", path);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    public static final class Builder {
        private String operation;
        private String field;
        private String resource;
        private Object id;
        private String action;
        private String endpoint;
        private String path;

        private Builder() {}

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder field(String field) {
            this.field = field;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder id(Object id) {
            this.id = id;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public ClassificationContext build() {
            return new ClassificationContext(operation, field, resource, id, action, endpoint, path);
        }
    }
}
