package com.hermes.core.repository;

import com.hermes.core.model.Fate;
import java.util.List;

/**
 * Read access to fates.
 */
public interface FateRepository {

    /**
     * Get every fate that the given event type opens or completes.
     * 
     * @param eventTypeId The creation or completion event type
     * @return All associated fates ordered by id, unpaginated
     */
    List<Fate> findAssociated(long eventTypeId);
}
