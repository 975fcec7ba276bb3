package com.openforge.agentchat.status;

import com.openforge.agentchat.config.AgentProperties;
import com.openforge.agentchat.llm.LlmRouter;
import com.openforge.agentchat.session.SessionStore;
import com.openforge.agentchat.tool.ToolRegistry;
import com.openforge.agentchat.websocket.ConnectionManager;
import com.openforge.agentchat.websocket.WsMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service info, health and aggregate status.
 *
 * Endpoints:
 *   GET  /, /api/v1/             name, version and entry points
 *   GET  /health                 liveness
 *   GET  /api/v1/health          liveness plus per-component status
 *   GET  /api/v1/system/status   tools, sessions, connections, configuration
 *   POST /api/v1/system/broadcast  push a system_message to every open socket
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final AgentProperties   agentProperties;
    private final LlmRouter         llmRouter;
    private final ToolRegistry      toolRegistry;
    private final SessionStore      sessionStore;
    private final ConnectionManager connectionManager;

    @GetMapping({"/", "/api/v1/"})
    public ServiceInfo root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/api/v1/health");
        endpoints.put("tools", "/api/v1/tools");
        endpoints.put("chat", "/api/v1/chat");
        endpoints.put("websocket", "/api/v1/ws/{connection_id}");
        return new ServiceInfo(agentProperties.app().name(), agentProperties.app().version(),
                "Agentic Chat Assistant API", "operational", endpoints);
    }

    @GetMapping("/health")
    public Map<String, String> liveness() {
        return Map.of("status", "healthy", "version", agentProperties.app().version());
    }

    @GetMapping("/api/v1/health")
    public HealthCheck health() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("agent_orchestrator", "healthy");
        services.put("tool_registry", "healthy");
        services.put("intent_classifier", "healthy");
        services.put("openai_api", llmRouter.isConfigured() ? "configured" : "not_configured");
        return new HealthCheck("healthy", Instant.now(), agentProperties.app().version(), services);
    }

    @GetMapping("/api/v1/system/status")
    public SystemStatus status() {
        Map<String, Map<String, Object>> toolStatus = toolRegistry.status();
        long enabled = toolStatus.values().stream()
                .filter(t -> Boolean.TRUE.equals(t.get("enabled")))
                .count();

        List<String> sessions = sessionStore.activeSessions();
        long totalMessages = sessions.stream()
                .flatMap(id -> sessionStore.stats(id).stream())
                .mapToLong(s -> s.messageCount())
                .sum();

        return new SystemStatus(
                new SystemInfo("operational", agentProperties.app().version(), agentProperties.app().debug()),
                new ToolsInfo(toolStatus.size(), enabled, toolStatus),
                new SessionsInfo(sessions.size(), totalMessages),
                new ConnectionsInfo(connectionManager.connectionCount()),
                new ConfigurationInfo(llmRouter.isConfigured(), agentProperties.app().corsOrigins()));
    }

    @PostMapping("/api/v1/system/broadcast")
    public BroadcastResponse broadcast(@RequestBody Map<String, String> body) {
        String message = body.get("message");
        if (message == null || message.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Message is required");
        }
        int recipients = connectionManager.connectionCount();
        connectionManager.broadcast(WsMessage.system(message));
        log.info("[SystemController] Broadcast system message to {} connection(s)", recipients);
        return new BroadcastResponse(message, recipients);
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record ServiceInfo(String name, String version, String description, String status,
                              Map<String, String> endpoints) {}

    public record HealthCheck(String status, Instant timestamp, String version, Map<String, String> services) {}

    public record SystemStatus(SystemInfo system, ToolsInfo tools, SessionsInfo sessions,
                               ConnectionsInfo connections, ConfigurationInfo configuration) {}

    public record SystemInfo(String status, String version, boolean debugMode) {}

    public record ToolsInfo(int totalTools, long enabledTools, Map<String, Map<String, Object>> toolStatus) {}

    public record SessionsInfo(int activeSessions, long totalMessages) {}

    public record ConnectionsInfo(int websocketConnections) {}

    public record ConfigurationInfo(boolean openaiConfigured, List<String> corsOrigins) {}

    public record BroadcastResponse(String message, int recipients) {}
}
