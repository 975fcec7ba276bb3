package com.openforge.agentchat.tool;

import com.openforge.agentchat.config.AppConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ToolController.class)
@Import(AppConfig.class)
class ToolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ToolRegistry toolRegistry;

    private final StubTool echo = StubTool.returning("echo", "util", Map.of("ok", true)).requiring("input");

    @Test
    void list_shouldReturnEnabledDefinitions() throws Exception {
        when(toolRegistry.definitions()).thenReturn(List.of(echo.definition()));

        mockMvc.perform(get("/api/v1/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("echo"))
                .andExpect(jsonPath("$[0].required_params[0]").value("input"))
                .andExpect(jsonPath("$[0].parameters.input.type").value("string"));
    }

    @Test
    void get_shouldReturn404ForUnknownTool() throws Exception {
        when(toolRegistry.getTool("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/tools/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Tool 'ghost' not found"));
    }

    @Test
    void categories_shouldListToolsPerCategory() throws Exception {
        when(toolRegistry.categories()).thenReturn(List.of("util"));
        when(toolRegistry.getByCategory("util")).thenReturn(List.of(echo));

        mockMvc.perform(get("/api/v1/tools/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories[0]").value("util"))
                .andExpect(jsonPath("$.details.util.tool_count").value(1))
                .andExpect(jsonPath("$.details.util.tools[0]").value("echo"));
    }

    @Test
    void execute_shouldPassBodyAsParameters() throws Exception {
        when(toolRegistry.execute(eq("echo"), anyMap()))
                .thenReturn(ToolResult.completed("echo", Map.of("ok", true)).withExecutionTime(0.01));

        mockMvc.perform(post("/api/v1/tools/echo/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"input\": \"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tool_name").value("echo"))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.result.ok").value(true));

        verify(toolRegistry).execute("echo", Map.of("input", "hi"));
    }

    @Test
    void search_shouldRequireAQuery() throws Exception {
        mockMvc.perform(post("/api/v1/tools/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Search query is required"));
    }

    @Test
    void search_shouldReturnMatches() throws Exception {
        when(toolRegistry.search("ech")).thenReturn(List.of(echo));

        mockMvc.perform(post("/api/v1/tools/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"ech\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.results[0].name").value("echo"))
                .andExpect(jsonPath("$.results[0].enabled").value(true));
    }

    @Test
    void toggle_shouldReportNewStateOr404() throws Exception {
        when(toolRegistry.toggle("echo")).thenReturn(Optional.of(false));
        when(toolRegistry.toggle("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/tools/echo/toggle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("disabled"))
                .andExpect(jsonPath("$.message").value("Tool 'echo' has been disabled"));
        mockMvc.perform(post("/api/v1/tools/ghost/toggle"))
                .andExpect(status().isNotFound());
    }
}
