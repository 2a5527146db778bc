package com.hermes.engine.aggregation;

import com.hermes.core.representation.Representation;
import java.util.List;

/**
 * An event type with a window over its events and all of its fates.
 * The fates list is published under the singular key {@code fate}.
 */
public record EventTypeDocument(
    long id,
    String category,
    String state,
    String description,
    String href,
    int limit,
    int offset,
    List<Representation> events,
    List<Representation> fate
) {
    public EventTypeDocument {
        events = List.copyOf(events);
        fate = List.copyOf(fate);
    }
}
