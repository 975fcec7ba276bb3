package com.openforge.agentchat.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open chat sockets by connection id, and which connection currently
 * serves each session.
 *
 * Sockets are wrapped in a ConcurrentWebSocketSessionDecorator because
 * progress frames are sent from pipeline threads while the socket thread may
 * be answering a ping.  A send that fails drops the connection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionManager {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT  = 512 * 1024;

    private final ObjectMapper objectMapper;

    private final Map<String, WebSocketSession> connections        = new ConcurrentHashMap<>();
    private final Map<String, String>           sessionConnections = new ConcurrentHashMap<>();

    public void connect(String connectionId, WebSocketSession socket) {
        WebSocketSession previous = connections.put(connectionId,
                new ConcurrentWebSocketSessionDecorator(socket, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        if (previous != null) {
            log.warn("[WebSocket] Connection id {} reused, replacing the old socket", connectionId);
        }
        log.info("[WebSocket] Connection established: {} ({} open)", connectionId, connections.size());
    }

    public void disconnect(String connectionId) {
        if (connections.remove(connectionId) != null) {
            log.info("[WebSocket] Connection closed: {}", connectionId);
        }
        sessionConnections.values().removeIf(connectionId::equals);
    }

    /** Route frames for sessionId to connectionId from now on. */
    public void associate(String connectionId, String sessionId) {
        sessionConnections.put(sessionId, connectionId);
    }

    /** @return false if the connection is unknown or the send failed */
    public boolean send(String connectionId, WsMessage message) {
        WebSocketSession socket = connections.get(connectionId);
        if (socket == null) {
            log.debug("[WebSocket] Dropping {} for unknown connection {}", message.type().value(), connectionId);
            return false;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("[WebSocket] Could not serialize {} frame: {}", message.type().value(), e.getMessage(), e);
            return false;
        }
        try {
            socket.sendMessage(new TextMessage(payload));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("[WebSocket] Send to {} failed, dropping connection: {}", connectionId, e.getMessage());
            disconnect(connectionId);
            return false;
        }
    }

    public boolean sendToSession(String sessionId, WsMessage message) {
        String connectionId = sessionConnections.get(sessionId);
        return connectionId != null && send(connectionId, message);
    }

    public void broadcast(WsMessage message) {
        for (String connectionId : List.copyOf(connections.keySet())) {
            send(connectionId, message);
        }
    }

    public int connectionCount() {
        return connections.size();
    }

    public boolean isConnected(String connectionId) {
        return connections.containsKey(connectionId);
    }
}
