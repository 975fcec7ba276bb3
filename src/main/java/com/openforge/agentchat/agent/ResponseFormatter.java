package com.openforge.agentchat.agent;

import com.openforge.agentchat.domain.MessageContent;
import com.openforge.agentchat.intent.IntentClassification;
import com.openforge.agentchat.tool.ToolResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a batch of tool results into the content blocks of the answer.
 *
 * Order: one block per completed result (in result order), then a single
 * error block covering every failure, then, only when nothing completed, a
 * fallback text chosen by intent.
 */
@Component
public class ResponseFormatter {

    private static final Map<String, String> FALLBACKS = Map.of(
            "text_generation", "I understand you're asking: '%s'. I'd be happy to help, but I'm currently unable to generate a detailed response. Please try again or rephrase your question.",
            "code_generation", "I see you need help with coding. While I can't execute code right now, I can suggest that you're looking for help with: '%s'. Please try again later.",
            "web_search", "You're looking for information about: '%s'. I'm currently unable to search the web, but I recommend checking reliable sources for this information.",
            "image_generation", "I understand you want to create an image related to: '%s'. Image generation is currently unavailable, but I can help describe what such an image might look like.",
            "calculation", "I see you need help with calculations: '%s'. While my calculation tools are unavailable, you might want to use a calculator or math software.",
            "data_analysis", "You're looking to analyze data related to: '%s'. Data analysis tools are currently unavailable, but I can suggest general approaches to your analysis needs.");

    private static final String GENERIC_FALLBACK =
            "I received your message: '%s'. I'm currently unable to process this request fully, but I'm here to help. Please try again or ask something else.";

    public List<MessageContent> format(IntentClassification classification,
                                       List<ToolResult> results,
                                       String query) {
        List<ToolResult> completed = results.stream().filter(ToolResult::succeeded).toList();
        List<ToolResult> failed    = results.stream().filter(r -> !r.succeeded()).toList();

        List<MessageContent> blocks = new ArrayList<>();
        for (ToolResult result : completed) {
            MessageContent block = render(result);
            if (block != null) blocks.add(block);
        }

        if (!failed.isEmpty()) {
            String lines = failed.stream()
                    .map(r -> "Tool '%s' failed: %s".formatted(r.toolName(), r.error()))
                    .collect(Collectors.joining("\n"));
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("failed_tools", failed.stream().map(ToolResult::toolName).toList());
            blocks.add(MessageContent.error("Some tools encountered errors:\n" + lines, metadata));
        }

        if (completed.isEmpty()) {
            blocks.add(fallback(classification.intent(), query));
        }
        return blocks;
    }

    MessageContent fallback(String intent, String query) {
        String text = FALLBACKS.getOrDefault(intent, GENERIC_FALLBACK).formatted(query);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fallback", true);
        metadata.put("original_intent", intent);
        return MessageContent.text(text, metadata);
    }

    /** Null when text_generation completed with no text. */
    private static MessageContent render(ToolResult result) {
        Map<String, Object> payload = result.result();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool_used", result.toolName());

        // tool-specific rendering needs a payload; without one every tool gets the data block
        String renderer = payload == null || payload.isEmpty() ? "" : result.toolName();
        switch (renderer) {
            case "text_generation" -> {
                if (!(payload.get("generated_text") instanceof String text) || text.isEmpty()) {
                    return null;
                }
                metadata.put("model", payload.get("model_used"));
                metadata.put("tokens", payload.get("tokens_used"));
                metadata.put("execution_time", result.executionTime());
                return MessageContent.text(text, metadata);
            }
            case "code_execution" -> {
                metadata.put("language", payload.get("language"));
                metadata.put("execution_time", result.executionTime());
                Object output = payload.get("output");
                return MessageContent.code(output == null ? "" : output.toString(), metadata);
            }
            case "image_generation" -> {
                Map<String, Object> image = new LinkedHashMap<>();
                image.put("url", payload.getOrDefault("image_url", ""));
                image.put("description", payload.getOrDefault("description", ""));
                metadata.put("execution_time", result.executionTime());
                return MessageContent.image(image, metadata);
            }
            default -> {
                metadata.put("execution_time", result.executionTime());
                return MessageContent.data(payload == null ? Map.of() : payload, metadata);
            }
        }
    }
}
