package com.openforge.agentchat.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Schema of one tool parameter, in the JSON-schema-like shape the classifier
 * prompt and the /tools endpoints expose.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParameterSpec(
        String type,
        String description,
        @JsonProperty("default") Object defaultValue,
        Number minimum,
        Number maximum,
        @JsonProperty("enum") List<String> enumValues
) {

    public static ParameterSpec string(String description) {
        return new ParameterSpec("string", description, null, null, null, null);
    }

    public static ParameterSpec integer(String description, int min, int max, int defaultValue) {
        return new ParameterSpec("integer", description, defaultValue, min, max, null);
    }

    public static ParameterSpec number(String description, double min, double max, double defaultValue) {
        return new ParameterSpec("number", description, defaultValue, min, max, null);
    }

    public static ParameterSpec oneOf(String description, List<String> values, String defaultValue) {
        return new ParameterSpec("string", description, defaultValue, null, null, List.copyOf(values));
    }
}
