package com.argus.app.health;

import com.argus.app.stream.ActivityStreamRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness check with a summary of open activity viewers.
 */
@RestController
public class HealthEndpoint {

    private final ActivityStreamRegistry viewers;
    private final ObjectMapper mapper;

    public HealthEndpoint(ActivityStreamRegistry viewers, ObjectMapper mapper) {
        this.viewers = viewers;
        this.mapper = mapper;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var stream = node.putObject("viewers");
        stream.put("open", viewers.viewerCount());
        stream.put("listeners", viewers.listenerCount());
        var byStatus = stream.putObject("by_status");
        viewers.statusCounts().forEach((status, count) -> byStatus.put(status.wireName(), count));
        var sessions = stream.putObject("sessions");
        viewers.connectionStates().forEach((id, status) -> sessions.put(id, status.wireName()));

        return node;
    }
}
