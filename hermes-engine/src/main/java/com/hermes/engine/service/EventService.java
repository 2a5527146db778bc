package com.hermes.engine.service;

import com.hermes.core.exception.NotFoundException;
import com.hermes.core.model.Event;
import com.hermes.core.model.Host;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.repository.EventRepository;
import com.hermes.core.repository.EventRepository.EventQuery;
import com.hermes.core.repository.HostRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Read access to the event log.
 */
@Service
public class EventService {

    private final EventRepository eventRepository;
    private final HostRepository hostRepository;

    public EventService(EventRepository eventRepository, HostRepository hostRepository) {
        this.eventRepository = eventRepository;
        this.hostRepository = hostRepository;
    }

    @Transactional(readOnly = true)
    public Event getEvent(long eventId) {
        return eventRepository.findById(eventId)
            .orElseThrow(() -> new NotFoundException("Event", eventId));
    }

    /**
     * List events, oldest first.
     * 
     * @param hostname Only events of this host, or null for all hosts
     * @param eventTypeId Only events of this type, or null for all types
     * @param page Window to return
     * @return Matching events; empty when the hostname is unknown
     */
    @Transactional(readOnly = true)
    public PagedResult<Event> queryEvents(String hostname, Long eventTypeId, PageRequest page) {
        Long hostId = null;
        if (hostname != null) {
            Optional<Host> host = hostRepository.findByHostname(hostname);
            if (host.isEmpty()) {
                return PagedResult.empty(page);
            }
            hostId = host.get().id();
        }
        EventQuery query = new EventQuery(hostId, eventTypeId);
        return PagedResult.of(
            eventRepository.find(query, page.offset(), page.limit()),
            eventRepository.count(query),
            page);
    }
}
