package com.openforge.agentchat.tool;

import java.util.List;
import java.util.Map;

/**
 * Holds the identity, enabled flag and attached listener shared by concrete
 * tools, and checks required parameters for presence.
 */
public abstract class AbstractAgentTool implements AgentTool {

    private final String name;
    private final String description;
    private final String category;

    private volatile boolean enabled = true;
    private volatile ToolProgressListener progressListener = ToolProgressListener.NOOP;

    protected AbstractAgentTool(String name, String description, String category) {
        this.name        = name;
        this.description = description;
        this.category    = category;
    }

    @Override public String name()        { return name; }
    @Override public String description() { return description; }
    @Override public String category()    { return category; }

    @Override public boolean isEnabled() { return enabled; }
    @Override public void enable()       { enabled = true; }
    @Override public void disable()      { enabled = false; }

    @Override
    public ToolProgressListener progressListener() {
        return progressListener;
    }

    @Override
    public void setProgressListener(ToolProgressListener listener) {
        this.progressListener = listener != null ? listener : ToolProgressListener.NOOP;
    }

    @Override
    public ToolDefinition definition() {
        return new ToolDefinition(name, description, parameterSchema(), requiredParameterNames(),
                category, enabled);
    }

    /** Base check: every required parameter is present and non-null. */
    @Override
    public boolean validateParameters(Map<String, Object> parameters) {
        if (parameters == null) return false;
        for (String required : requiredParameterNames()) {
            if (parameters.get(required) == null) return false;
        }
        return true;
    }

    @Override
    public List<String> requiredParameters() {
        return requiredParameterNames();
    }

    protected abstract Map<String, ParameterSpec> parameterSchema();

    protected abstract List<String> requiredParameterNames();
}
