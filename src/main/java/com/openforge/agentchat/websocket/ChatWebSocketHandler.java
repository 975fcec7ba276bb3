package com.openforge.agentchat.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentchat.agent.AgentOrchestrator;
import com.openforge.agentchat.agent.dto.AgentResponse;
import com.openforge.agentchat.agent.dto.UserQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Chat protocol over a raw WebSocket.
 *
 * Control frames (session_init, session_history, ping) are answered on the
 * socket thread.  chat_message is acknowledged immediately and then run on
 * the pipeline executor, which streams progress_update frames followed by
 * agent_response.  A bad frame is answered with an error frame and the
 * connection stays open.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private final AgentOrchestrator orchestrator;
    private final ConnectionManager connections;
    private final ObjectMapper      objectMapper;
    private final Executor          pipelineExecutor;

    public ChatWebSocketHandler(AgentOrchestrator orchestrator,
                                ConnectionManager connections,
                                ObjectMapper objectMapper,
                                @Qualifier("agentPipelineExecutor") Executor pipelineExecutor) {
        this.orchestrator     = orchestrator;
        this.connections      = connections;
        this.objectMapper     = objectMapper;
        this.pipelineExecutor = pipelineExecutor;
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.connect(connectionId(session), session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connections.disconnect(connectionId(session));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        String connectionId = connectionId(session);
        log.warn("[WebSocket] Transport error on {}: {}", connectionId, exception.getMessage());
        connections.disconnect(connectionId);
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connectionId = connectionId(session);
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("[WebSocket] Malformed frame on {}: {}", connectionId, e.getOriginalMessage());
            connections.send(connectionId, WsMessage.error("Invalid message format: " + e.getOriginalMessage()));
            return;
        }
        if (frame == null || !frame.isObject()) {
            connections.send(connectionId, WsMessage.error("Invalid message format: expected a JSON object"));
            return;
        }

        String type = frame.path("type").asText(null);
        JsonNode data = frame.path("data");
        WsMessageType messageType = WsMessageType.from(type).orElse(null);
        if (messageType == null) {
            connections.send(connectionId, WsMessage.error("Unknown message type: " + type));
            return;
        }

        switch (messageType) {
            case CHAT_MESSAGE    -> handleChatMessage(connectionId, data);
            case SESSION_INIT    -> handleSessionInit(connectionId, data);
            case SESSION_HISTORY -> handleSessionHistory(connectionId, data);
            case PING            -> connections.send(connectionId, WsMessage.pong());
            default -> connections.send(connectionId, WsMessage.error("Unknown message type: " + type));
        }
    }

    private void handleChatMessage(String connectionId, JsonNode data) {
        String text      = textOrNull(data, "message");
        String sessionId = textOrNull(data, "session_id");
        String userId    = textOrNull(data, "user_id");

        if (text == null) {
            connections.send(connectionId, WsMessage.error("Empty message received"));
            return;
        }
        if (sessionId != null) {
            connections.associate(connectionId, sessionId);
        }

        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("message_id", sessionId);
        connections.send(connectionId, WsMessage.of(WsMessageType.MESSAGE_RECEIVED, ack));

        UserQuery query = new UserQuery(text, sessionId, userId, null);
        try {
            pipelineExecutor.execute(() -> runPipeline(connectionId, query));
        } catch (RejectedExecutionException e) {
            log.error("[WebSocket] Pipeline executor rejected query from {}", connectionId, e);
            connections.send(connectionId, WsMessage.error("Error processing chat message: " + e.getMessage()));
        }
    }

    private void runPipeline(String connectionId, UserQuery query) {
        try {
            AgentResponse response = orchestrator.processQuery(query, update -> {
                Map<String, Object> progress = new LinkedHashMap<>();
                progress.put("message", update.message());
                progress.put("progress", update.progress());
                progress.put("session_id", update.sessionId());
                connections.send(connectionId, WsMessage.of(WsMessageType.PROGRESS_UPDATE, progress));
            });

            if (query.sessionId() == null) {
                connections.associate(connectionId, response.sessionId());
            }

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message_id", response.messageId());
            payload.put("content", response.content());
            payload.put("tools_used", response.toolsUsed());
            payload.put("processing_time", response.processingTime());
            payload.put("session_id", response.sessionId());
            connections.send(connectionId, WsMessage.of(WsMessageType.AGENT_RESPONSE, payload));
        } catch (Exception e) {
            log.error("[WebSocket] Chat processing failed on {}: {}", connectionId, e.getMessage(), e);
            connections.send(connectionId, WsMessage.error("Error processing chat message: " + e.getMessage()));
        }
    }

    private void handleSessionInit(String connectionId, JsonNode data) {
        String sessionId = textOrNull(data, "session_id");
        if (sessionId == null) {
            connections.send(connectionId, WsMessage.error("No session_id provided"));
            return;
        }
        connections.associate(connectionId, sessionId);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", sessionId);
        payload.put("status", "connected");
        connections.send(connectionId, WsMessage.of(WsMessageType.SESSION_INITIALIZED, payload));
    }

    private void handleSessionHistory(String connectionId, JsonNode data) {
        String sessionId = textOrNull(data, "session_id");
        if (sessionId == null) {
            connections.send(connectionId, WsMessage.error("No session_id provided"));
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("session_id", sessionId);
        payload.put("history", orchestrator.sessionHistory(sessionId));
        connections.send(connectionId, WsMessage.of(WsMessageType.SESSION_HISTORY, payload));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /** Last path segment of /api/v1/ws/{connectionId}; the socket id when the URI is missing. */
    static String connectionId(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null || uri.getPath() == null) {
            return session.getId();
        }
        String path = uri.getPath();
        String last = path.substring(path.lastIndexOf('/') + 1);
        return last.isBlank() ? session.getId() : last;
    }

    /** Blank text counts as absent. */
    private static String textOrNull(JsonNode data, String field) {
        JsonNode node = data == null ? null : data.get(field);
        if (node == null || node.isNull()) return null;
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
