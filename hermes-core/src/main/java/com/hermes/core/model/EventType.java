package com.hermes.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog entry classifying events by category and state.
 * 
 * Primary Key: id
 * Unique Constraint: (category, state)
 * 
 * Invariants:
 * - category and state never change after creation
 * - description is the only mutable field
 */
public record EventType(
    long id,
    String category,
    EventTypeState state,
    String description
) implements ApiResource {

    public static EventType create(String category, EventTypeState state, String description) {
        return new EventType(0L, category, state, description);
    }

    public EventType withId(long id) {
        return new EventType(id, category, state, description);
    }

    public EventType withDescription(String newDescription) {
        return new EventType(id, category, state, newDescription);
    }

    @Override
    public String href(String basePath) {
        return basePath + "/eventtypes/" + id;
    }

    @Override
    public Map<String, Object> toDict(String basePath) {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("id", id);
        dict.put("category", category);
        dict.put("state", state.value());
        dict.put("description", description);
        dict.put("href", href(basePath));
        return dict;
    }
}
