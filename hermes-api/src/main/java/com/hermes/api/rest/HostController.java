package com.hermes.api.rest;

import com.hermes.core.model.Host;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.pagination.PaginationPolicy;
import com.hermes.core.repository.HostRepository.HostQuery;
import com.hermes.core.representation.RepresentationSelector;
import com.hermes.engine.aggregation.HostDocument;
import com.hermes.engine.aggregation.ResourceAggregator;
import com.hermes.engine.service.DeleteResult;
import com.hermes.engine.service.HostService;
import com.hermes.engine.service.PagedResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * REST API for hosts.
 */
@RestController
@RequestMapping("${hermes.api.base-path:/api/v1}/hosts")
public class HostController {

    private final HostService hostService;
    private final ResourceAggregator aggregator;
    private final PaginationPolicy paginationPolicy;
    private final String basePath;

    public HostController(
            HostService hostService,
            ResourceAggregator aggregator,
            PaginationPolicy paginationPolicy,
            RepresentationSelector selector) {
        this.hostService = hostService;
        this.aggregator = aggregator;
        this.paginationPolicy = paginationPolicy;
        this.basePath = selector.basePath();
    }

    /**
     * Create a host.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> createHost(
            @RequestBody CreateHostRequest request) {
        
        Host host = hostService.createHost(request.hostname());
        
        return ResponseEntity.created(URI.create(host.href(basePath)))
            .body(ApiResponse.ok(host.toDict(basePath)));
    }

    /**
     * List hosts, optionally filtered by hostname.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<HostListResponse>> listHosts(
            @RequestParam(required = false) String hostname,
            @RequestParam(required = false) String offset,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) List<String> expand) {
        
        PageRequest page = paginationPolicy.resolve(offset, limit, expand);
        PagedResult<Host> hosts = hostService.queryHosts(new HostQuery(hostname), page);
        
        return ResponseEntity.ok(ApiResponse.ok(new HostListResponse(
            page.limit(),
            page.offset(),
            hosts.total(),
            hosts.items().stream().map(h -> h.toDict(basePath)).toList()
        )));
    }

    /**
     * Get a host with its labors, quests and events.
     */
    @GetMapping("/{hostname}")
    public ResponseEntity<ApiResponse<HostDocument>> getHost(
            @PathVariable String hostname,
            @RequestParam(required = false) String offset,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) List<String> expand) {
        
        PageRequest page = paginationPolicy.resolve(offset, limit, expand);
        return ResponseEntity.ok(ApiResponse.ok(aggregator.renderHost(hostname, page)));
    }

    /**
     * Rename a host.
     */
    @PutMapping("/{hostname}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> updateHost(
            @PathVariable String hostname,
            @RequestBody UpdateHostRequest request) {
        
        Host host = hostService.updateHost(hostname, request.hostname());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("host", host.toDict(basePath))));
    }

    /**
     * Delete a host that nothing references any more.
     */
    @DeleteMapping("/{hostname}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteHost(@PathVariable String hostname) {
        DeleteResult result = hostService.deleteHost(hostname);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("message", result.message())));
    }

    // ========== DTOs ==========

    public record CreateHostRequest(String hostname) {}

    public record UpdateHostRequest(String hostname) {}

    public record HostListResponse(
        int limit,
        int offset,
        long totalHosts,
        List<Map<String, Object>> hosts
    ) {}
}
