package com.hermes.api.rest;

import com.hermes.core.model.Event;
import com.hermes.core.model.EventType;
import com.hermes.core.model.EventTypeState;
import com.hermes.core.model.Host;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class EventControllerTest {

    private ApiTestContext context;
    private MockMvc mockMvc;
    private Host web;
    private EventType reboot;

    @BeforeEach
    void setUp() {
        context = new ApiTestContext();
        mockMvc = context.mockMvc;
        web = context.host("web-01");
        Host db = context.host("db-01");
        reboot = context.eventType("system-reboot", EventTypeState.REQUIRED);
        context.event(web, reboot, "2024-01-16T10:00:00Z");
        context.event(db, reboot, "2024-01-15T10:00:00Z");
        context.event(web, reboot, "2024-01-14T10:00:00Z");
    }

    @Test
    void listIsChronological() throws Exception {
        mockMvc.perform(get("/api/v1/events"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalEvents").value(3))
            .andExpect(jsonPath("$.data.events[*].id", contains(3, 2, 1)));
    }

    @Test
    void listFiltersByHostname() throws Exception {
        mockMvc.perform(get("/api/v1/events").param("hostname", "web-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalEvents").value(2))
            .andExpect(jsonPath("$.data.events[*].hostId", everyItem(is((int) web.id()))));
    }

    @Test
    void unknownHostnameYieldsEmptyPage() throws Exception {
        mockMvc.perform(get("/api/v1/events").param("hostname", "ghost"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalEvents").value(0))
            .andExpect(jsonPath("$.data.events", hasSize(0)));
    }

    @Test
    void getSingleEvent() throws Exception {
        Event event = context.event(web, reboot, "2024-02-01T08:30:00Z");

        mockMvc.perform(get("/api/v1/events/" + event.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.timestamp").value("2024-02-01T08:30:00Z"))
            .andExpect(jsonPath("$.data.eventTypeId").value((int) reboot.id()))
            .andExpect(jsonPath("$.data.href").value("/api/v1/events/" + event.id()));
    }

    @Test
    void unknownEventIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/events/404"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value(404));
    }
}
