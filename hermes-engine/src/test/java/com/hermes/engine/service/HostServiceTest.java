package com.hermes.engine.service;

import com.hermes.core.exception.ConflictException;
import com.hermes.core.exception.NotFoundException;
import com.hermes.core.exception.ValidationException;
import com.hermes.core.model.EventTypeState;
import com.hermes.core.model.Host;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.repository.HostRepository;
import com.hermes.core.repository.HostRepository.HostQuery;
import com.hermes.engine.metrics.HermesMetrics;
import com.hermes.engine.test.InMemoryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class HostServiceTest {

    private InMemoryStorage storage;
    private HostService hostService;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        hostService = new HostService(storage.hosts, storage.metrics);
    }

    @Test
    @DisplayName("Created host can be fetched; a second create with the same name conflicts")
    void createHost_roundTripAndDuplicate() {
        Host created = hostService.createHost("h1");

        Host fetched = hostService.getHost("h1");
        assertThat(fetched.hostname()).isEqualTo("h1");
        assertThat(fetched.id()).isPositive().isEqualTo(created.id());

        assertThatThrownBy(() -> hostService.createHost("h1"))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("h1")
            .extracting(e -> ((ConflictException) e).getErrorCode())
            .isEqualTo(ConflictException.ERROR_CODE);
        assertThat(storage.meterRegistry.counter(HermesMetrics.CONFLICTS, "entity", "host").count())
            .isEqualTo(1.0);
    }

    @Test
    void createHost_hostnamesAreCaseSensitive() {
        hostService.createHost("web-01");

        assertThatCode(() -> hostService.createHost("WEB-01")).doesNotThrowAnyException();
    }

    @Test
    void createHost_withMissingHostname_shouldFailValidation() {
        assertThatThrownBy(() -> hostService.createHost(null))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Missing Required Argument: hostname");
        assertThatThrownBy(() -> hostService.createHost(""))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void createHost_shouldPreserveStorageMessageOnConflict() {
        HostRepository repository = mock(HostRepository.class);
        when(repository.create(any())).thenThrow(new DuplicateKeyException("unique violation: hosts_hostname_key"));
        HostService service = new HostService(repository, new HermesMetrics());

        assertThatThrownBy(() -> service.createHost("web-01"))
            .isInstanceOf(ConflictException.class)
            .hasMessage("unique violation: hosts_hostname_key")
            .hasCauseInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void updateHost_shouldRename() {
        Host original = hostService.createHost("old-name");

        Host renamed = hostService.updateHost("old-name", "new-name");

        assertThat(renamed.id()).isEqualTo(original.id());
        assertThat(hostService.getHost("new-name").id()).isEqualTo(original.id());
        assertThatThrownBy(() -> hostService.getHost("old-name")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void updateHost_toTakenName_shouldConflictAndLeaveHostUnchanged() {
        hostService.createHost("a");
        hostService.createHost("b");

        assertThatThrownBy(() -> hostService.updateHost("a", "b")).isInstanceOf(ConflictException.class);
        assertThat(hostService.getHost("a").hostname()).isEqualTo("a");
    }

    @Test
    void updateHost_withUnknownHost_shouldFailNotFound() {
        assertThatThrownBy(() -> hostService.updateHost("ghost", "other"))
            .isInstanceOf(NotFoundException.class)
            .hasMessage("No such Host ghost found");
    }

    @Test
    void updateHost_withMissingNewName_shouldFailValidation() {
        hostService.createHost("a");

        assertThatThrownBy(() -> hostService.updateHost("a", null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void deleteHost_shouldRemoveHost() {
        hostService.createHost("doomed");

        DeleteResult result = hostService.deleteHost("doomed");

        assertThat(result.performed()).isTrue();
        assertThat(result.message()).isEqualTo("Host doomed deleted.");
        assertThat(storage.hosts.findByHostname("doomed")).isEmpty();
    }

    @Test
    void deleteHost_withEvents_shouldConflictInsteadOfCascading() {
        Host host = hostService.createHost("busy");
        storage.event(host, storage.eventType("system-reboot", EventTypeState.REQUIRED), Instant.now());

        assertThatThrownBy(() -> hostService.deleteHost("busy"))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("events");
        assertThat(storage.hosts.findByHostname("busy")).isPresent();
    }

    @Test
    void deleteHost_withUnknownHost_shouldFailNotFound() {
        assertThatThrownBy(() -> hostService.deleteHost("ghost")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void queryHosts_shouldFilterAndCount() {
        for (int i = 0; i < 5; i++) {
            hostService.createHost("host-" + i);
        }

        PagedResult<Host> all = hostService.queryHosts(HostQuery.all(), PageRequest.of(1, 2));
        PagedResult<Host> one = hostService.queryHosts(new HostQuery("host-3"), PageRequest.of(0, 10));

        assertThat(all.total()).isEqualTo(5);
        assertThat(all.items()).extracting(Host::hostname).containsExactly("host-1", "host-2");
        assertThat(one.total()).isEqualTo(1);
        assertThat(one.items()).extracting(Host::hostname).containsExactly("host-3");
    }
}
