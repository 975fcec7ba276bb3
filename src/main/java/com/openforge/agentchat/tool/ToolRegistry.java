package com.openforge.agentchat.tool;

import com.openforge.agentchat.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns every registered tool, indexed by name and by category.
 *
 * Both indices are guarded by one lock, so a reader never sees a category
 * entry that points at a name missing from the primary index.  Tool runs
 * happen outside the lock.
 *
 * Batches ({@link #executeMany}) fan out on the shared agentToolExecutor;
 * each run is bounded by agent.tools.timeout-seconds, counted from the moment
 * the run starts on a pool thread, so time spent queued behind other tools
 * does not count against it.  A run that exceeds it is reported FAILED but is
 * not interrupted.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Object lock = new Object();
    private final Map<String, AgentTool>   tools      = new LinkedHashMap<>();
    private final Map<String, Set<String>> categories = new LinkedHashMap<>();

    private final ExecutorService executor;
    private final Duration        toolTimeout;

    @Autowired
    public ToolRegistry(List<AgentTool> discovered,
                        @Qualifier("agentToolExecutor") ExecutorService executor,
                        AgentProperties properties) {
        this(executor, Duration.ofSeconds(properties.tools().timeoutSeconds()));
        discovered.forEach(this::register);
        log.info("[ToolRegistry] {} tool(s) registered: {}", discovered.size(), tools.keySet());
    }

    public ToolRegistry(ExecutorService executor, Duration toolTimeout) {
        this.executor    = executor;
        this.toolTimeout = toolTimeout;
    }

    // ── Registration ─────────────────────────────────────────────────────────

    /**
     * Add a tool.  A tool already registered under the same name is replaced
     * and dropped from its old category.
     *
     * @return false if the tool could not be registered
     */
    public boolean register(AgentTool tool) {
        try {
            String name     = tool.name();
            String category = tool.category();
            if (name == null || name.isBlank()) {
                log.warn("[ToolRegistry] Refusing tool with blank name: {}", tool.getClass().getName());
                return false;
            }
            if (category == null || category.isBlank()) {
                log.warn("[ToolRegistry] Refusing tool '{}' without a category", name);
                return false;
            }
            synchronized (lock) {
                AgentTool previous = tools.put(name, tool);
                if (previous != null) {
                    log.warn("[ToolRegistry] Tool '{}' already registered, replacing {} with {}",
                            name, previous.getClass().getSimpleName(), tool.getClass().getSimpleName());
                    removeFromCategory(previous.category(), name);
                }
                categories.computeIfAbsent(category, c -> new LinkedHashSet<>()).add(name);
            }
            log.debug("[ToolRegistry] Registered '{}' in category '{}'", name, category);
            return true;
        } catch (Exception e) {
            log.error("[ToolRegistry] Failed to register tool: {}", e.getMessage(), e);
            return false;
        }
    }

    /** @return false if no tool is registered under that name */
    public boolean unregister(String name) {
        synchronized (lock) {
            AgentTool removed = tools.remove(name);
            if (removed == null) {
                return false;
            }
            removeFromCategory(removed.category(), name);
        }
        log.info("[ToolRegistry] Unregistered '{}'", name);
        return true;
    }

    // ── Lookups ──────────────────────────────────────────────────────────────

    public Optional<AgentTool> getTool(String name) {
        if (name == null) return Optional.empty();
        synchronized (lock) {
            return Optional.ofNullable(tools.get(name));
        }
    }

    public List<AgentTool> getAll() {
        synchronized (lock) {
            return List.copyOf(tools.values());
        }
    }

    public List<AgentTool> getEnabled() {
        return getAll().stream().filter(AgentTool::isEnabled).toList();
    }

    public List<AgentTool> getByCategory(String category) {
        synchronized (lock) {
            Set<String> names = categories.getOrDefault(category, Set.of());
            return names.stream()
                    .map(tools::get)
                    .filter(AgentTool::isEnabled)
                    .toList();
        }
    }

    /** Category names with at least one registered tool, in registration order. */
    public List<String> categories() {
        synchronized (lock) {
            return List.copyOf(categories.keySet());
        }
    }

    /** Definitions of the enabled tools.  A tool whose definition throws is left out. */
    public List<ToolDefinition> definitions() {
        List<ToolDefinition> result = new ArrayList<>();
        for (AgentTool tool : getEnabled()) {
            try {
                result.add(tool.definition());
            } catch (Exception e) {
                log.error("[ToolRegistry] Could not build definition for '{}': {}",
                        tool.name(), e.getMessage(), e);
            }
        }
        return result;
    }

    /** Case-insensitive substring match on name, description and category of enabled tools. */
    public List<AgentTool> search(String query) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        return getEnabled().stream()
                .filter(t -> contains(t.name(), needle)
                        || contains(t.description(), needle)
                        || contains(t.category(), needle))
                .toList();
    }

    // ── Enable / disable ─────────────────────────────────────────────────────

    public boolean enable(String name) {
        return getTool(name).map(t -> { t.enable(); return true; }).orElse(false);
    }

    public boolean disable(String name) {
        return getTool(name).map(t -> { t.disable(); return true; }).orElse(false);
    }

    /** Flip the tool's enabled flag; returns the new state, or empty if unknown. */
    public Optional<Boolean> toggle(String name) {
        return getTool(name).map(t -> {
            if (t.isEnabled()) t.disable(); else t.enable();
            log.info("[ToolRegistry] Tool '{}' is now {}", name, t.isEnabled() ? "enabled" : "disabled");
            return t.isEnabled();
        });
    }

    // ── Execution ────────────────────────────────────────────────────────────

    public ToolResult execute(String name, Map<String, Object> parameters) {
        return execute(name, parameters, null);
    }

    /**
     * Run one tool on the calling thread.  Unknown and disabled tools yield a
     * FAILED result; nothing is thrown.
     */
    public ToolResult execute(String name, Map<String, Object> parameters, ToolProgressListener listener) {
        Optional<AgentTool> found = getTool(name);
        if (found.isEmpty()) {
            return ToolResult.failed(name, "Tool '%s' not found".formatted(name));
        }
        AgentTool tool = found.get();
        if (!tool.isEnabled()) {
            return ToolResult.failed(name, "Tool '%s' is disabled".formatted(name));
        }
        try {
            return listener != null ? tool.safeExecute(parameters, listener) : tool.safeExecute(parameters);
        } catch (Exception e) {
            log.error("[ToolRegistry] '{}' escaped its wrapper: {}", name, e.getMessage(), e);
            return ToolResult.failed(name, "Tool execution exception: " + e.getMessage());
        }
    }

    /**
     * Run every request concurrently.  The returned list is index-aligned with
     * the input; each slot holds that request's result, or a FAILED result
     * naming the request's tool when its run threw or timed out.
     */
    public List<ToolResult> executeMany(List<ToolRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(requests.size());
        for (ToolRequest request : requests) {
            futures.add(submit(request));
        }

        List<ToolResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), requests.get(i)));
        }

        long failed = results.stream().filter(r -> !r.succeeded()).count();
        log.info("[ToolRegistry] Batch of {} finished, {} failed", results.size(), failed);
        return results;
    }

    /** Per-tool snapshot: name → {enabled, category, description}. */
    public Map<String, Map<String, Object>> status() {
        Map<String, Map<String, Object>> status = new LinkedHashMap<>();
        for (AgentTool tool : getAll()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("enabled", tool.isEnabled());
            entry.put("category", tool.category());
            entry.put("description", tool.description());
            status.put(tool.name(), entry);
        }
        return status;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private CompletableFuture<ToolResult> submit(ToolRequest request) {
        String name = request.toolName();
        if (name == null || name.isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failed("unknown", "Tool execution exception: missing tool name"));
        }
        CompletableFuture<ToolResult> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                // deadline starts with the run, not with the submission
                future.orTimeout(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
                try {
                    future.complete(execute(name, request.parameters()));
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private ToolResult await(CompletableFuture<ToolResult> future, ToolRequest request) {
        String name = request.toolName() == null || request.toolName().isBlank()
                ? "unknown" : request.toolName();
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            String message = cause instanceof TimeoutException
                    ? "timed out after %ds".formatted(toolTimeout.toSeconds())
                    : cause.getMessage();
            log.warn("[ToolRegistry] '{}' did not complete: {}", name, message);
            return ToolResult.failed(name, "Tool execution exception: " + message);
        }
    }

    private void removeFromCategory(String category, String name) {
        Set<String> names = categories.get(category);
        if (names == null) return;
        names.remove(name);
        if (names.isEmpty()) {
            categories.remove(category);
        }
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
