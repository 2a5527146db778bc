package com.hermes.engine.aggregation;

import com.hermes.core.representation.Representation;
import java.util.List;

/**
 * A host with windows over its labors, quests and events.
 * 
 * Invariants:
 * - labors and quests have the same length; quests[i] owns labors[i]
 * - lastEvent is the newest event of the host, whatever the window
 */
public record HostDocument(
    long id,
    String hostname,
    String href,
    int limit,
    int offset,
    List<Representation> labors,
    List<Representation> quests,
    String lastEvent,
    List<Representation> events
) {
    public HostDocument {
        if (labors.size() != quests.size()) {
            throw new IllegalArgumentException(String.format(
                "labors and quests must pair up: %d labors, %d quests",
                labors.size(), quests.size()));
        }
        labors = List.copyOf(labors);
        quests = List.copyOf(quests);
        events = List.copyOf(events);
    }
}
