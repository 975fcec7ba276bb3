package com.openforge.agentchat.tool;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inspect, search, toggle and directly run registered tools.
 *
 * Endpoints:
 *   GET  /api/v1/tools                   definitions of the enabled tools
 *   GET  /api/v1/tools/categories        categories with their enabled tools
 *   GET  /api/v1/tools/{name}            one definition, enabled or not
 *   POST /api/v1/tools/{name}/execute    run one tool with the request body as parameters
 *   POST /api/v1/tools/search            {"query": "..."} substring search
 *   POST /api/v1/tools/{name}/toggle     flip the enabled flag
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public List<ToolDefinition> list() {
        return toolRegistry.definitions();
    }

    @GetMapping("/categories")
    public CategoriesResponse categories() {
        List<String> categories = toolRegistry.categories();
        Map<String, CategoryDetail> details = new LinkedHashMap<>();
        for (String category : categories) {
            List<String> names = toolRegistry.getByCategory(category).stream().map(AgentTool::name).toList();
            details.put(category, new CategoryDetail(names.size(), names));
        }
        return new CategoriesResponse(categories, details);
    }

    @GetMapping("/{toolName}")
    public ToolDefinition get(@PathVariable String toolName) {
        return findOrThrow(toolName).definition();
    }

    /** Unknown or disabled tools come back as a FAILED result, not an HTTP error. */
    @PostMapping("/{toolName}/execute")
    public ToolResult execute(@PathVariable String toolName,
                              @RequestBody(required = false) Map<String, Object> parameters) {
        return toolRegistry.execute(toolName, parameters != null ? parameters : Map.of());
    }

    @PostMapping("/search")
    public SearchResponse search(@RequestBody(required = false) Map<String, String> body) {
        String query = body == null ? null : body.get("query");
        if (query == null || query.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Search query is required");
        }
        List<SearchHit> hits = toolRegistry.search(query).stream()
                .map(t -> new SearchHit(t.name(), t.description(), t.category(), t.isEnabled()))
                .toList();
        return new SearchResponse(query, hits, hits.size());
    }

    @PostMapping("/{toolName}/toggle")
    public ResponseEntity<ToggleResponse> toggle(@PathVariable String toolName) {
        boolean enabled = toolRegistry.toggle(toolName)
                .orElseThrow(() -> notFound(toolName));
        String status = enabled ? "enabled" : "disabled";
        return ResponseEntity.ok(new ToggleResponse(toolName, status,
                "Tool '%s' has been %s".formatted(toolName, status)));
    }

    private AgentTool findOrThrow(String toolName) {
        return toolRegistry.getTool(toolName).orElseThrow(() -> notFound(toolName));
    }

    private static ResponseStatusException notFound(String toolName) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool '" + toolName + "' not found");
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record CategoryDetail(int toolCount, List<String> tools) {}

    public record CategoriesResponse(List<String> categories, Map<String, CategoryDetail> details) {}

    public record SearchHit(String name, String description, String category, boolean enabled) {}

    public record SearchResponse(String query, List<SearchHit> results, int count) {}

    public record ToggleResponse(String toolName, String status, String message) {}
}
