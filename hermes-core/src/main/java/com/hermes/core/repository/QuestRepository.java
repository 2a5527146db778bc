package com.hermes.core.repository;

import com.hermes.core.model.Quest;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to quests. Quests are written by the workflow engine.
 */
public interface QuestRepository {

    Optional<Quest> findById(long questId);

    /**
     * Resolve several quests in one call.
     * 
     * @param questIds Quest ids, duplicates allowed
     * @return Found quests keyed by id; unknown ids are absent
     */
    Map<Long, Quest> findByIds(Collection<Long> questIds);
}
