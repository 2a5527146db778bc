package com.hermes.core.repository;

import com.hermes.core.model.Labor;
import java.util.List;
import java.util.Optional;

/**
 * Read access to labors. Labors are written by the workflow engine.
 */
public interface LaborRepository {

    Optional<Labor> findById(long laborId);

    /**
     * Get a window of the labors performed against a host.
     * 
     * @param hostId The host id
     * @param offset Rows to skip
     * @param limit Maximum number of results
     * @return Labors ordered by creation time ascending, then id
     */
    List<Labor> findByHost(long hostId, int offset, int limit);

    /**
     * Check if any labor references the host.
     */
    boolean existsByHost(long hostId);
}
