package com.hermes.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Follow-up action tied to an event type: an event of the creation type
 * opens a labor that an event of the completion type closes.
 */
public record Fate(
    long id,
    long creationEventTypeId,
    long completionEventTypeId,
    boolean intermediate,
    String description
) implements ApiResource {

    @Override
    public String href(String basePath) {
        return basePath + "/fates/" + id;
    }

    @Override
    public Map<String, Object> toDict(String basePath) {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("id", id);
        dict.put("creationEventTypeId", creationEventTypeId);
        dict.put("completionEventTypeId", completionEventTypeId);
        dict.put("intermediate", intermediate);
        dict.put("description", description);
        dict.put("href", href(basePath));
        return dict;
    }
}
