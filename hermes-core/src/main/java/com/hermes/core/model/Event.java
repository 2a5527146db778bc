package com.hermes.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of something that happened to a host.
 * 
 * Primary Key: id
 * Index: (hostId, timestamp), (eventTypeId, timestamp)
 * 
 * Invariants:
 * - Events are never updated or deleted
 */
public record Event(
    long id,
    
    // Foreign keys
    long hostId,
    long eventTypeId,
    
    Instant timestamp,
    String user,
    String note
) implements ApiResource {

    public static Event create(long hostId, long eventTypeId, Instant timestamp, String user, String note) {
        return new Event(0L, hostId, eventTypeId, timestamp, user, note);
    }

    public Event withId(long id) {
        return new Event(id, hostId, eventTypeId, timestamp, user, note);
    }

    @Override
    public String href(String basePath) {
        return basePath + "/events/" + id;
    }

    @Override
    public Map<String, Object> toDict(String basePath) {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("id", id);
        dict.put("hostId", hostId);
        dict.put("eventTypeId", eventTypeId);
        dict.put("timestamp", Timestamps.format(timestamp));
        dict.put("user", user);
        dict.put("note", note);
        dict.put("href", href(basePath));
        return dict;
    }
}
