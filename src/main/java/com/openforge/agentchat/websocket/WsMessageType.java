package com.openforge.agentchat.websocket;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Envelope types on the chat socket.
 */
public enum WsMessageType {

    // ── Client → server ──────────────────────────────────────────────────────
    CHAT_MESSAGE("chat_message"),
    SESSION_INIT("session_init"),
    SESSION_HISTORY("session_history"),
    PING("ping"),

    // ── Server → client ──────────────────────────────────────────────────────
    MESSAGE_RECEIVED("message_received"),
    PROGRESS_UPDATE("progress_update"),
    AGENT_RESPONSE("agent_response"),
    SESSION_INITIALIZED("session_initialized"),
    PONG("pong"),
    ERROR("error"),
    SYSTEM_MESSAGE("system_message");

    private final String value;

    WsMessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<WsMessageType> from(String value) {
        return Arrays.stream(values()).filter(t -> t.value.equals(value)).findFirst();
    }
}
