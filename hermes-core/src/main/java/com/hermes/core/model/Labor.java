package com.hermes.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of work performed against a host as part of a quest.
 * Created and transitioned by the workflow engine; read-only here.
 * 
 * Primary Key: id
 * Foreign Keys: hostId, questId, startingEventId, completionEventId
 */
public record Labor(
    long id,
    long hostId,
    long questId,
    
    // Events that opened and closed this labor
    long startingEventId,
    Long completionEventId,
    
    Instant creationTime,
    Instant completionTime,
    
    // Acknowledgement
    String ackUser,
    Instant ackTime
) implements ApiResource {

    @Override
    public String href(String basePath) {
        return basePath + "/labors/" + id;
    }

    @Override
    public Map<String, Object> toDict(String basePath) {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("id", id);
        dict.put("hostId", hostId);
        dict.put("questId", questId);
        dict.put("startingEventId", startingEventId);
        dict.put("completionEventId", completionEventId);
        dict.put("creationTime", Timestamps.format(creationTime));
        dict.put("completionTime", Timestamps.format(completionTime));
        dict.put("ackUser", ackUser);
        dict.put("ackTime", Timestamps.format(ackTime));
        dict.put("href", href(basePath));
        return dict;
    }
}
