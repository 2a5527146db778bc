package com.hermes.core.representation;

import com.hermes.core.model.ApiResource;
import java.util.Set;

/**
 * Chooses between the full and the reference form of a related entity.
 * Pure and stateless.
 */
public class RepresentationSelector {

    public static final String LABORS = "labors";
    public static final String QUESTS = "quests";
    public static final String EVENTS = "events";
    public static final String FATES = "fates";

    private final String basePath;

    public RepresentationSelector(String basePath) {
        this.basePath = basePath;
    }

    /**
     * Render an entity for a relation.
     * 
     * @param relation Relation name, e.g. {@link #LABORS}
     * @param expand Active expand-set
     * @param entity The related entity
     * @return {@link Representation.Full} when the relation is expanded,
     *         {@link Representation.Reference} otherwise
     */
    public Representation select(String relation, Set<String> expand, ApiResource entity) {
        if (expand.contains(relation)) {
            return new Representation.Full(entity.id(), entity.toDict(basePath));
        }
        return new Representation.Reference(entity.id(), entity.href(basePath));
    }

    public String basePath() {
        return basePath;
    }
}
