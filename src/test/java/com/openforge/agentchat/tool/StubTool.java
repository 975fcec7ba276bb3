package com.openforge.agentchat.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Configurable tool for registry, wrapper and pipeline tests. */
public class StubTool extends AbstractAgentTool {

    @FunctionalInterface
    public interface Behavior {
        ToolResult run(StubTool tool, Map<String, Object> parameters) throws Exception;
    }

    private final Behavior behavior;
    private final List<String> required = new ArrayList<>();
    private final AtomicInteger executions = new AtomicInteger();

    public StubTool(String name, String category, Behavior behavior) {
        super(name, "Stub tool " + name, category);
        this.behavior = behavior;
    }

    public static StubTool returning(String name, String category, Map<String, Object> result) {
        return new StubTool(name, category, (tool, params) -> ToolResult.completed(name, result));
    }

    public static StubTool throwing(String name, String category, String message) {
        return new StubTool(name, category, (tool, params) -> {
            throw new IllegalStateException(message);
        });
    }

    public static StubTool sleeping(String name, String category, long millis) {
        return new StubTool(name, category, (tool, params) -> {
            Thread.sleep(millis);
            return ToolResult.completed(name, Map.of("slept_ms", millis));
        });
    }

    public StubTool requiring(String... parameters) {
        required.addAll(List.of(parameters));
        return this;
    }

    public int executions() {
        return executions.get();
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolProgressListener progress) throws Exception {
        executions.incrementAndGet();
        return behavior.run(this, parameters);
    }

    @Override
    protected Map<String, ParameterSpec> parameterSchema() {
        Map<String, ParameterSpec> schema = new LinkedHashMap<>();
        for (String name : required) {
            schema.put(name, ParameterSpec.string("Required " + name));
        }
        return schema;
    }

    @Override
    protected List<String> requiredParameterNames() {
        return List.copyOf(required);
    }
}
