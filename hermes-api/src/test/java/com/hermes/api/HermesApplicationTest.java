package com.hermes.api;

import com.hermes.engine.persistence.InMemoryHostRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Boots the whole application on in-memory storage.
 */
@SpringBootTest
@AutoConfigureMockMvc
class HermesApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ApplicationContext applicationContext;

    @Test
    void memoryStorageNeedsNoDataSource() {
        assertThat(applicationContext.getBeansOfType(DataSource.class)).isEmpty();
        assertThat(applicationContext.getBean(InMemoryHostRepository.class)).isNotNull();
    }

    @Test
    void createdHostIsServed() throws Exception {
        mockMvc.perform(post("/api/v1/hosts")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"hostname\": \"boot-01\"}"))
            .andExpect(status().isCreated());

        mockMvc.perform(get("/api/v1/hosts/boot-01"))
            .andExpect(status().isOk())
            .andExpect(header().exists("X-Request-Id"))
            .andExpect(jsonPath("$.data.hostname").value("boot-01"))
            .andExpect(jsonPath("$.data.lastEvent").isEmpty());
    }

    @Test
    void healthReportsStorage() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.components.hermes.details.storage").value("memory"));
    }
}
