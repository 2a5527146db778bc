package com.hermes.engine.aggregation;

import com.hermes.core.exception.NotFoundException;
import com.hermes.core.model.ApiResource;
import com.hermes.core.model.Event;
import com.hermes.core.model.EventType;
import com.hermes.core.model.Fate;
import com.hermes.core.model.Host;
import com.hermes.core.model.Labor;
import com.hermes.core.model.Quest;
import com.hermes.core.model.Timestamps;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.repository.*;
import com.hermes.core.representation.Representation;
import com.hermes.core.representation.RepresentationSelector;
import com.hermes.engine.logging.LoggingContext;
import com.hermes.engine.metrics.HermesMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.hermes.core.representation.RepresentationSelector.*;

/**
 * Assembles composite documents for hosts and event types.
 * 
 * One {@link PageRequest} window is shared by every paginated relation in a
 * document: the labor window and the event window of a host both start at
 * the same offset and have the same limit. Event windows are counted back
 * from the newest event and rendered oldest first.
 */
@Service
public class ResourceAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResourceAggregator.class);

    private final HostRepository hostRepository;
    private final EventTypeRepository eventTypeRepository;
    private final EventRepository eventRepository;
    private final LaborRepository laborRepository;
    private final QuestRepository questRepository;
    private final FateRepository fateRepository;
    private final RepresentationSelector selector;
    private final HermesMetrics metrics;

    public ResourceAggregator(
            HostRepository hostRepository,
            EventTypeRepository eventTypeRepository,
            EventRepository eventRepository,
            LaborRepository laborRepository,
            QuestRepository questRepository,
            FateRepository fateRepository,
            RepresentationSelector selector,
            HermesMetrics metrics) {
        this.hostRepository = hostRepository;
        this.eventTypeRepository = eventTypeRepository;
        this.eventRepository = eventRepository;
        this.laborRepository = laborRepository;
        this.questRepository = questRepository;
        this.fateRepository = fateRepository;
        this.selector = selector;
        this.metrics = metrics;
    }

    /**
     * Render a host with its labors, their quests and its events.
     * 
     * @param hostname The host to render
     * @param page Window and expand-set shared by all relations
     * @throws NotFoundException if the host does not exist
     */
    @Transactional(readOnly = true)
    public HostDocument renderHost(String hostname, PageRequest page) {
        long started = System.nanoTime();
        Host host = hostRepository.findByHostname(hostname)
            .orElseThrow(() -> new NotFoundException("Host", hostname));

        try (var ctx = LoggingContext.forHost(hostname, "render")) {
            List<Labor> labors = laborRepository.findByHost(host.id(), page.offset(), page.limit());
            Map<Long, Quest> questsById = questRepository.findByIds(
                labors.stream().map(Labor::questId).toList());

            List<Representation> laborReps = new ArrayList<>(labors.size());
            List<Representation> questReps = new ArrayList<>(labors.size());
            for (Labor labor : labors) {
                Quest quest = questsById.get(labor.questId());
                if (quest == null) {
                    throw new IllegalStateException(String.format(
                        "Labor %d references missing quest %d", labor.id(), labor.questId()));
                }
                laborReps.add(selector.select(LABORS, page.expand(), labor));
                questReps.add(selector.select(QUESTS, page.expand(), quest));
            }

            List<Representation> eventReps = renderAll(EVENTS, page,
                eventRepository.findRecentByHost(host.id(), page.offset(), page.limit()));
            String lastEvent = eventRepository.findLatestByHost(host.id())
                .map(Event::timestamp)
                .map(Timestamps::format)
                .orElse(null);

            log.debug("Rendered host with {} labors and {} events (offset={}, limit={})",
                laborReps.size(), eventReps.size(), page.offset(), page.limit());
            metrics.documentRendered("host", Duration.ofNanos(System.nanoTime() - started));

            return new HostDocument(
                host.id(),
                host.hostname(),
                host.href(selector.basePath()),
                page.limit(),
                page.offset(),
                laborReps,
                questReps,
                lastEvent,
                eventReps
            );
        }
    }

    /**
     * Render an event type with a window over its events and all its fates.
     * 
     * @param eventTypeId The event type to render
     * @param page Window for the events and the expand-set
     * @throws NotFoundException if the event type does not exist
     */
    @Transactional(readOnly = true)
    public EventTypeDocument renderEventType(long eventTypeId, PageRequest page) {
        long started = System.nanoTime();
        EventType eventType = eventTypeRepository.findById(eventTypeId)
            .orElseThrow(() -> new NotFoundException("EventType", eventTypeId));

        try (var ctx = LoggingContext.forEventType(eventTypeId, "render")) {
            List<Representation> eventReps = renderAll(EVENTS, page,
                eventRepository.findRecentByEventType(eventTypeId, page.offset(), page.limit()));
            List<Fate> fates = fateRepository.findAssociated(eventTypeId);
            List<Representation> fateReps = renderAll(FATES, page, fates);

            log.debug("Rendered event type with {} events and {} fates", eventReps.size(), fateReps.size());
            metrics.documentRendered("eventtype", Duration.ofNanos(System.nanoTime() - started));

            return new EventTypeDocument(
                eventType.id(),
                eventType.category(),
                eventType.state().value(),
                eventType.description(),
                eventType.href(selector.basePath()),
                page.limit(),
                page.offset(),
                eventReps,
                fateReps
            );
        }
    }

    private List<Representation> renderAll(
            String relation, PageRequest page, List<? extends ApiResource> entities) {
        return entities.stream()
            .map(entity -> selector.select(relation, page.expand(), entity))
            .toList();
    }
}
