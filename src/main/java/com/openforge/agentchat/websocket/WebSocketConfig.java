package com.openforge.agentchat.websocket;

import com.openforge.agentchat.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Raw WebSocket endpoint for the chat front end.
 *
 * Connection flow:
 *   1. Connect to  ws://host/api/v1/ws/{connectionId}
 *   2. Optionally send session_init to bind a session to the connection
 *   3. Send chat_message; receive message_received, progress_update frames,
 *      then agent_response
 *
 * Frames are JSON envelopes {type, data, timestamp}; see {@link WsMessageType}.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatWebSocketHandler;
    private final AgentProperties      agentProperties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, "/api/v1/ws/*")
                .setAllowedOriginPatterns(agentProperties.app().corsOrigins().toArray(String[]::new));
    }
}
