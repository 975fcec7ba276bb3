package com.openforge.agentchat.agent;

import com.openforge.agentchat.agent.dto.AgentResponse;
import com.openforge.agentchat.agent.dto.UserQuery;
import com.openforge.agentchat.domain.ChatMessage;
import com.openforge.agentchat.session.SessionStats;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST surface of the chat pipeline.
 *
 * Endpoints:
 *   POST   /api/v1/chat                          run a query synchronously (no progress frames)
 *   GET    /api/v1/sessions                      ids of the sessions in memory
 *   GET    /api/v1/sessions/{id}/history         full conversation of one session
 *   GET    /api/v1/sessions/{id}/stats           counters of one session, 404 when unknown
 *   DELETE /api/v1/sessions/{id}                 drop a session and its history, 404 when unknown
 *
 * Streaming clients use the WebSocket endpoint instead of /chat.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AgentController {

    private final AgentOrchestrator orchestrator;

    // ── Chat ─────────────────────────────────────────────────────────────────

    @PostMapping("/chat")
    public ResponseEntity<AgentResponse> chat(@Valid @RequestBody UserQuery query) {
        log.info("[AgentController] Chat request for session {}",
                query.sessionId() != null ? query.sessionId() : "(new)");
        return ResponseEntity.ok(orchestrator.processQuery(query));
    }

    // ── Sessions ─────────────────────────────────────────────────────────────

    @GetMapping("/sessions")
    public ResponseEntity<SessionsResponse> sessions() {
        List<String> ids = orchestrator.activeSessions();
        return ResponseEntity.ok(new SessionsResponse(ids.size(), ids));
    }

    @GetMapping("/sessions/{sessionId}/history")
    public ResponseEntity<HistoryResponse> history(@PathVariable String sessionId) {
        List<ChatMessage> history = orchestrator.sessionHistory(sessionId);
        return ResponseEntity.ok(new HistoryResponse(sessionId, history, history.size()));
    }

    @GetMapping("/sessions/{sessionId}/stats")
    public ResponseEntity<SessionStats> stats(@PathVariable String sessionId) {
        return orchestrator.sessionStats(sessionId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Session '" + sessionId + "' not found"));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<MessageResponse> clear(@PathVariable String sessionId) {
        if (!orchestrator.clearSession(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session '" + sessionId + "' not found");
        }
        return ResponseEntity.ok(new MessageResponse("Session '" + sessionId + "' cleared successfully"));
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record SessionsResponse(int activeSessions, List<String> sessions) {}

    public record HistoryResponse(String sessionId, List<ChatMessage> history, int messageCount) {}

    public record MessageResponse(String message) {}
}
