package com.openforge.agentchat.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound frame: {"type": ..., "data": {...}, "timestamp": ...}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WsMessage(WsMessageType type, Map<String, Object> data, Instant timestamp) {

    public static WsMessage of(WsMessageType type, Map<String, Object> data) {
        return new WsMessage(type, data, Instant.now());
    }

    public static WsMessage error(String error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        data.put("timestamp", Instant.now());
        return of(WsMessageType.ERROR, data);
    }

    public static WsMessage pong() {
        return of(WsMessageType.PONG, Map.of("timestamp", Instant.now()));
    }

    public static WsMessage system(String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", message);
        data.put("timestamp", Instant.now());
        return of(WsMessageType.SYSTEM_MESSAGE, data);
    }
}
