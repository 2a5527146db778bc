package com.hermes.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named grouping of labors. Owned by the workflow engine.
 */
public record Quest(
    long id,
    String creator,
    String description,
    Instant embarkTime,
    Instant targetTime,
    Instant completionTime
) implements ApiResource {

    @Override
    public String href(String basePath) {
        return basePath + "/quests/" + id;
    }

    @Override
    public Map<String, Object> toDict(String basePath) {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("id", id);
        dict.put("creator", creator);
        dict.put("description", description);
        dict.put("embarkTime", Timestamps.format(embarkTime));
        dict.put("targetTime", Timestamps.format(targetTime));
        dict.put("completionTime", Timestamps.format(completionTime));
        dict.put("href", href(basePath));
        return dict;
    }
}
