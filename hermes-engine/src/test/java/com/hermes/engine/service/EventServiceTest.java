package com.hermes.engine.service;

import com.hermes.core.exception.NotFoundException;
import com.hermes.core.model.Event;
import com.hermes.core.model.EventType;
import com.hermes.core.model.EventTypeState;
import com.hermes.core.model.Host;
import com.hermes.core.pagination.PageRequest;
import com.hermes.engine.test.InMemoryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class EventServiceTest {

    private InMemoryStorage storage;
    private EventService service;
    private Host web;
    private Host db;
    private EventType reboot;
    private EventType audit;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        service = new EventService(storage.events, storage.hosts);
        web = storage.host("web-01");
        db = storage.host("db-01");
        reboot = storage.eventType("system-reboot", EventTypeState.REQUIRED);
        audit = storage.eventType("audit", EventTypeState.READY);

        storage.event(web, reboot, Instant.parse("2024-01-03T00:00:00Z"));
        storage.event(web, audit, Instant.parse("2024-01-01T00:00:00Z"));
        storage.event(db, reboot, Instant.parse("2024-01-02T00:00:00Z"));
    }

    @Test
    void queryEvents_shouldListOldestFirst() {
        PagedResult<Event> result = service.queryEvents(null, null, PageRequest.of(0, 10));

        assertThat(result.total()).isEqualTo(3);
        assertThat(result.items()).extracting(Event::timestamp).isSorted();
    }

    @Test
    void queryEvents_shouldFilterByHostnameAndType() {
        PagedResult<Event> webEvents = service.queryEvents("web-01", null, PageRequest.of(0, 10));
        PagedResult<Event> webReboots = service.queryEvents("web-01", reboot.id(), PageRequest.of(0, 10));

        assertThat(webEvents.items()).allMatch(e -> e.hostId() == web.id()).hasSize(2);
        assertThat(webReboots.items()).singleElement()
            .satisfies(e -> assertThat(e.eventTypeId()).isEqualTo(reboot.id()));
    }

    @Test
    void queryEvents_withUnknownHostname_shouldBeEmpty() {
        PagedResult<Event> result = service.queryEvents("nobody", null, PageRequest.of(0, 10));

        assertThat(result.items()).isEmpty();
        assertThat(result.total()).isZero();
    }

    @Test
    void getEvent_withUnknownId_shouldFailNotFound() {
        assertThatThrownBy(() -> service.getEvent(999L))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("No such Event 999 found");
    }
}
