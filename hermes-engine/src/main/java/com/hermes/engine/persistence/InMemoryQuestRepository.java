package com.hermes.engine.persistence;

import com.hermes.core.model.Quest;
import com.hermes.core.repository.QuestRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of QuestRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryQuestRepository implements QuestRepository {
    
    private final Map<Long, Quest> quests = new ConcurrentHashMap<>();

    public void save(Quest quest) {
        quests.put(quest.id(), quest);
    }
    
    @Override
    public Optional<Quest> findById(long questId) {
        return Optional.ofNullable(quests.get(questId));
    }
    
    @Override
    public Map<Long, Quest> findByIds(Collection<Long> questIds) {
        Map<Long, Quest> found = new HashMap<>();
        for (Long id : questIds) {
            Quest quest = quests.get(id);
            if (quest != null) {
                found.put(id, quest);
            }
        }
        return found;
    }
}
