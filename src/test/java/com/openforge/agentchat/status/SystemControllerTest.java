package com.openforge.agentchat.status;

import com.openforge.agentchat.config.AppConfig;
import com.openforge.agentchat.llm.LlmRouter;
import com.openforge.agentchat.session.SessionStats;
import com.openforge.agentchat.session.SessionStore;
import com.openforge.agentchat.tool.ToolRegistry;
import com.openforge.agentchat.websocket.ConnectionManager;
import com.openforge.agentchat.websocket.WsMessage;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SystemController.class)
@Import(AppConfig.class)
class SystemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean private LlmRouter llmRouter;
    @MockBean private ToolRegistry toolRegistry;
    @MockBean private SessionStore sessionStore;
    @MockBean private ConnectionManager connectionManager;

    @Test
    void health_shouldReportProviderConfiguration() throws Exception {
        when(llmRouter.isConfigured()).thenReturn(false);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.services.openai_api").value("not_configured"));
    }

    @Test
    void rootAndLiveness_shouldDescribeTheService() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Agentic Chat Assistant"))
                .andExpect(jsonPath("$.endpoints.chat").value("/api/v1/chat"));
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void status_shouldAggregateToolsSessionsAndConnections() throws Exception {
        // Given
        when(toolRegistry.status()).thenReturn(Map.of(
                "text_generation", Map.of("enabled", true, "category", "ai", "description", "d"),
                "other", Map.of("enabled", false, "category", "util", "description", "d")));
        when(sessionStore.activeSessions()).thenReturn(List.of("s-1", "s-2"));
        when(sessionStore.stats("s-1")).thenReturn(Optional.of(new SessionStats("s-1", Instant.now(), 3, 6, null)));
        when(sessionStore.stats("s-2")).thenReturn(Optional.of(new SessionStats("s-2", Instant.now(), 2, 4, null)));
        when(connectionManager.connectionCount()).thenReturn(4);
        when(llmRouter.isConfigured()).thenReturn(true);

        // When / Then
        mockMvc.perform(get("/api/v1/system/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.system.status").value("operational"))
                .andExpect(jsonPath("$.tools.total_tools").value(2))
                .andExpect(jsonPath("$.tools.enabled_tools").value(1))
                .andExpect(jsonPath("$.sessions.active_sessions").value(2))
                .andExpect(jsonPath("$.sessions.total_messages").value(5))
                .andExpect(jsonPath("$.connections.websocket_connections").value(4))
                .andExpect(jsonPath("$.configuration.openai_configured").value(true));
    }

    @Test
    void broadcast_shouldPushSystemMessage() throws Exception {
        when(connectionManager.connectionCount()).thenReturn(2);

        mockMvc.perform(post("/api/v1/system/broadcast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"maintenance at noon\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recipients").value(2));

        verify(connectionManager).broadcast(any(WsMessage.class));
    }
}
