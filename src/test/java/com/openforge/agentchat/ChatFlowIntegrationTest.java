package com.openforge.agentchat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full context without an LLM key: keyword classification, the text tool
 * disabled, every answer degraded to an error block plus a fallback text.
 */
@SpringBootTest(properties = {
        "agent.llm.primary.api-key=",
        "agent.llm.fallback.api-key="
})
@AutoConfigureMockMvc
class ChatFlowIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Chat without a provider answers with the disabled-tool error and the intent fallback")
    void chatWithoutProvider_shouldDegradeToFallback() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"Hello\", \"session_id\": \"it-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response_type").value("assistant"))
                .andExpect(jsonPath("$.session_id").value("it-1"))
                .andExpect(jsonPath("$.tools_used[0]").value("text_generation"))
                .andExpect(jsonPath("$.content", hasSize(2)))
                .andExpect(jsonPath("$.content[0].type").value("error"))
                .andExpect(jsonPath("$.content[0].content", containsString("Tool 'text_generation' is disabled")))
                .andExpect(jsonPath("$.content[1].type").value("text"))
                .andExpect(jsonPath("$.content[1].content", containsString("I understand you're asking: 'Hello'")))
                .andExpect(jsonPath("$.content[1].metadata.fallback").value(true));

        mockMvc.perform(get("/api/v1/sessions/it-1/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message_count").value(1))
                .andExpect(jsonPath("$.conversation_length").value(2));

        mockMvc.perform(delete("/api/v1/sessions/it-1"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/sessions/it-1/stats"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("The disabled text tool stays visible by name but leaves the enabled listing")
    void toolsWithoutProvider_shouldListNothingEnabled() throws Exception {
        mockMvc.perform(get("/api/v1/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(get("/api/v1/tools/text_generation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(jsonPath("$.services.openai_api").value("not_configured"));
    }
}
