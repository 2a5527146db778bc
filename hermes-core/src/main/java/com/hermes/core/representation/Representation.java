package com.hermes.core.representation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How a related entity appears inside a composite document: either its
 * full field map or a bare reference. Never both.
 */
public interface Representation {

    long id();

    @JsonIgnore
    boolean isFull();

    /**
     * Full field-level representation. Serialized as the field map itself.
     */
    record Full(long id, Map<String, Object> fields) implements Representation {

        public Full {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @JsonValue
        public Map<String, Object> json() {
            return fields;
        }

        @Override
        public boolean isFull() {
            return true;
        }
    }

    /**
     * Minimal reference: identity and canonical link.
     */
    record Reference(long id, String href) implements Representation {

        @JsonIgnore
        @Override
        public boolean isFull() {
            return false;
        }
    }
}
