package com.hermes.core.model;

import java.util.Map;

/**
 * An entity that can be addressed over the API.
 * Every resource has a numeric identity, a canonical link and a
 * field-level representation.
 */
public interface ApiResource {

    long id();

    /**
     * Canonical link to this resource under the given API base path.
     */
    String href(String basePath);

    /**
     * Full field-level representation, including {@code href}.
     * Iteration order of the returned map is the field order on the wire.
     */
    Map<String, Object> toDict(String basePath);
}
