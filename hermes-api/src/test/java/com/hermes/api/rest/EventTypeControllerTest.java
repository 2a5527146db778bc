package com.hermes.api.rest;

import com.hermes.core.model.EventType;
import com.hermes.core.model.EventTypeState;
import com.hermes.core.model.Host;
import com.hermes.core.repository.EventTypeRepository.EventTypeQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class EventTypeControllerTest {

    private ApiTestContext context;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        context = new ApiTestContext();
        mockMvc = context.mockMvc;
    }

    @Test
    void createThenReadEmptyEventType() throws Exception {
        mockMvc.perform(post("/api/v1/eventtypes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"category": "system-reboot", "state": "required", "description": "Reboot needed"}
                    """))
            .andExpect(status().isCreated())
            .andExpect(header().string("Location", "/api/v1/eventtypes/1"))
            .andExpect(jsonPath("$.data.state").value("required"));

        mockMvc.perform(get("/api/v1/eventtypes/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.category").value("system-reboot"))
            .andExpect(jsonPath("$.data.description").value("Reboot needed"))
            .andExpect(jsonPath("$.data.href").value("/api/v1/eventtypes/1"))
            .andExpect(jsonPath("$.data.events", hasSize(0)))
            .andExpect(jsonPath("$.data.fate", hasSize(0)));
    }

    @ParameterizedTest
    @CsvSource({
        "'{\"state\": \"required\", \"description\": \"d\"}', Missing Required Argument: category",
        "'{\"category\": \"c\", \"description\": \"d\"}', Missing Required Argument: state",
        "'{\"category\": \"c\", \"state\": \"required\"}', Missing Required Argument: description",
        "'{\"category\": \"c\", \"state\": \"pending\", \"description\": \"d\"}', 'Invalid argument state: pending'"
    })
    void invalidCreateIsBadRequest(String body, String message) throws Exception {
        mockMvc.perform(post("/api/v1/eventtypes")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value(message));
    }

    @Test
    void duplicateCategoryAndStateIsConflict() throws Exception {
        context.eventType("system-reboot", EventTypeState.REQUIRED);

        mockMvc.perform(post("/api/v1/eventtypes")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"category\": \"system-reboot\", \"state\": \"required\", \"description\": \"again\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    void updateChangesOnlyDescription() throws Exception {
        EventType type = context.eventType("system-reboot", EventTypeState.REQUIRED);

        mockMvc.perform(put("/api/v1/eventtypes/" + type.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": \"Reboot now\", \"category\": \"ignored\", \"state\": \"completed\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.eventType.description").value("Reboot now"))
            .andExpect(jsonPath("$.data.eventType.category").value("system-reboot"))
            .andExpect(jsonPath("$.data.eventType.state").value("required"));
    }

    @Test
    void updateWithoutDescriptionIsBadRequest() throws Exception {
        EventType type = context.eventType("system-reboot", EventTypeState.REQUIRED);

        mockMvc.perform(put("/api/v1/eventtypes/" + type.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("Missing Required Argument: description"));
    }

    @Test
    void updateUnknownEventTypeIsNotFound() throws Exception {
        mockMvc.perform(put("/api/v1/eventtypes/99")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\": \"x\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void deleteIsAcknowledgedButNotPerformed() throws Exception {
        EventType type = context.eventType("system-reboot", EventTypeState.REQUIRED);

        mockMvc.perform(delete("/api/v1/eventtypes/" + type.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.data.message").value("Not supported."));

        assertThat(context.eventTypes.findById(type.id())).isPresent();
    }

    @Test
    void deleteOfUnknownIdIsAlsoAcknowledged() throws Exception {
        mockMvc.perform(delete("/api/v1/eventtypes/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.data.message").value("Not supported."));

        assertThat(context.eventTypes.count(EventTypeQuery.all())).isZero();
    }

    @Test
    void completingEventTypeListsTheFate() throws Exception {
        EventType required = context.eventType("system-reboot", EventTypeState.REQUIRED);
        EventType completed = context.eventType("system-reboot", EventTypeState.COMPLETED);
        context.fate(4, required, completed);

        mockMvc.perform(get("/api/v1/eventtypes/" + completed.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.fate", hasSize(1)))
            .andExpect(jsonPath("$.data.fate[0].id").value(4))
            .andExpect(jsonPath("$.data.fate[0].href").value("/api/v1/fates/4"));
    }

    @Test
    void documentListsEventsAndFates() throws Exception {
        Host host = context.host("web-01");
        EventType required = context.eventType("system-reboot", EventTypeState.REQUIRED);
        EventType completed = context.eventType("system-reboot", EventTypeState.COMPLETED);
        context.event(host, required, "2024-01-15T10:00:00Z");
        context.event(host, required, "2024-01-16T10:00:00Z");
        context.fate(4, required, completed);

        mockMvc.perform(get("/api/v1/eventtypes/" + required.id()).param("expand", "fates"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.events[*].href",
                contains("/api/v1/events/1", "/api/v1/events/2")))
            .andExpect(jsonPath("$.data.fate[0].completionEventTypeId").value((int) completed.id()))
            .andExpect(jsonPath("$.data.fate[0].intermediate").value(false));
    }

    @Test
    void listFiltersByState() throws Exception {
        context.eventType("system-reboot", EventTypeState.REQUIRED);
        context.eventType("system-reboot", EventTypeState.COMPLETED);
        context.eventType("disk-swap", EventTypeState.REQUIRED);

        mockMvc.perform(get("/api/v1/eventtypes").param("state", "required"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalEventTypes").value(2))
            .andExpect(jsonPath("$.data.eventTypes[*].category", contains("system-reboot", "disk-swap")));
    }

    @Test
    void nonNumericIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/eventtypes/abc"))
            .andExpect(status().isBadRequest());
    }
}
