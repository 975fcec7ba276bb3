package com.openforge.agentchat.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Descriptor of a registered tool.  parameters keeps declaration order.
 */
public record ToolDefinition(
        String name,
        String description,
        Map<String, ParameterSpec> parameters,
        List<String> requiredParams,
        String category,
        boolean enabled
) {

    public ToolDefinition {
        parameters = parameters == null ? Map.of() : new LinkedHashMap<>(parameters);
        requiredParams = requiredParams == null ? List.of() : List.copyOf(requiredParams);
    }
}
