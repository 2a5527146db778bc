package com.hermes.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A managed machine, identified by its hostname.
 * 
 * Primary Key: id
 * Unique Constraint: hostname (case-sensitive)
 */
public record Host(
    long id,
    String hostname
) implements ApiResource {

    /**
     * Create a host that has not been stored yet.
     */
    public static Host create(String hostname) {
        return new Host(0L, hostname);
    }

    public Host withId(long id) {
        return new Host(id, hostname);
    }

    public Host withHostname(String newHostname) {
        return new Host(id, newHostname);
    }

    @Override
    public String href(String basePath) {
        return basePath + "/hosts/" + hostname;
    }

    @Override
    public Map<String, Object> toDict(String basePath) {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put("id", id);
        dict.put("hostname", hostname);
        dict.put("href", href(basePath));
        return dict;
    }
}
