package com.openforge.agentchat.tool.builtin;

import com.openforge.agentchat.llm.LlmClient;
import com.openforge.agentchat.llm.LlmProperties;
import com.openforge.agentchat.llm.LlmRouter;
import com.openforge.agentchat.llm.model.ChatRequest;
import com.openforge.agentchat.llm.model.ChatResponse;
import com.openforge.agentchat.llm.model.Message;
import com.openforge.agentchat.tool.AbstractAgentTool;
import com.openforge.agentchat.tool.ParameterSpec;
import com.openforge.agentchat.tool.ToolProgressListener;
import com.openforge.agentchat.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single-turn completion against the configured LLM provider.
 *
 * Parameters: prompt (required), max_tokens 1..4000, temperature 0..1, model.
 * Result: generated_text, model_used, tokens_used, finish_reason.
 *
 * Starts disabled when no provider has an API key.
 */
@Slf4j
@Component
public class TextGenerationTool extends AbstractAgentTool {

    public static final String NAME = "text_generation";

    private static final List<String> KNOWN_MODELS = List.of("gpt-3.5-turbo", "gpt-4", "gpt-4-turbo-preview");

    private final LlmRouter    router;
    private final int          defaultMaxTokens;
    private final double       defaultTemperature;
    private final String       defaultModel;
    private final List<String> allowedModels;

    public TextGenerationTool(LlmRouter router, LlmProperties llmProperties) {
        super(NAME, "Generate text responses using AI language models", "ai");
        this.router = router;

        LlmProperties.ProviderConfig primary = llmProperties.primary();
        this.defaultMaxTokens   = primary != null ? primary.maxTokens() : 2000;
        this.defaultTemperature = primary != null ? primary.temperature() : 0.7;
        this.defaultModel       = primary != null && primary.model() != null ? primary.model() : KNOWN_MODELS.get(0);

        Set<String> models = new LinkedHashSet<>(KNOWN_MODELS);
        models.add(defaultModel);
        this.allowedModels = List.copyOf(models);

        if (!router.isConfigured()) {
            log.warn("[TextGenerationTool] No LLM API key configured, tool disabled");
            disable();
        }
    }

    @Override
    protected Map<String, ParameterSpec> parameterSchema() {
        Map<String, ParameterSpec> schema = new LinkedHashMap<>();
        schema.put("prompt", ParameterSpec.string("The text prompt to generate a response for"));
        schema.put("max_tokens", ParameterSpec.integer("Maximum number of tokens to generate", 1, 4000, defaultMaxTokens));
        schema.put("temperature", ParameterSpec.number("Creativity level (0.0 to 1.0)", 0.0, 1.0, defaultTemperature));
        schema.put("model", ParameterSpec.oneOf("Language model to use", allowedModels, defaultModel));
        return schema;
    }

    @Override
    protected List<String> requiredParameterNames() {
        return List.of("prompt");
    }

    @Override
    public boolean validateParameters(Map<String, Object> parameters) {
        if (!super.validateParameters(parameters)) return false;
        if (!(parameters.get("prompt") instanceof String prompt) || prompt.isBlank()) return false;

        Object maxTokens = parameters.get("max_tokens");
        if (maxTokens != null && !(isWholeNumber(maxTokens)
                && ((Number) maxTokens).longValue() >= 1 && ((Number) maxTokens).longValue() <= 4000)) {
            return false;
        }
        Object temperature = parameters.get("temperature");
        if (temperature != null && !(temperature instanceof Number t
                && t.doubleValue() >= 0.0 && t.doubleValue() <= 1.0)) {
            return false;
        }
        Object model = parameters.get("model");
        return model == null || allowedModels.contains(model);
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolProgressListener progress) {
        if (!router.isConfigured()) {
            return ToolResult.failed(name(), "LLM client not initialized - check API key");
        }

        String prompt      = (String) parameters.get("prompt");
        int    maxTokens   = parameters.get("max_tokens") instanceof Number n ? n.intValue() : defaultMaxTokens;
        double temperature = parameters.get("temperature") instanceof Number t ? t.doubleValue() : defaultTemperature;
        String model       = parameters.get("model") instanceof String m ? m : defaultModel;

        try {
            progress.onProgress("Generating text response...", 0.3);
            ChatResponse response = router.chat(
                    ChatRequest.simple(model, List.of(Message.user(prompt)), maxTokens, temperature));
            progress.onProgress("Processing response...", 0.8);

            Map<String, Object> result = new HashMap<>();
            result.put("generated_text", response.firstContent());
            result.put("model_used", model);
            result.put("tokens_used", response.totalTokens());
            result.put("finish_reason", response.finishReason());
            return ToolResult.completed(name(), result);
        } catch (LlmClient.LlmException | IllegalStateException e) {
            log.warn("[TextGenerationTool] Generation failed: {}", e.getMessage());
            return ToolResult.failed(name(), "Text generation failed: " + e.getMessage());
        }
    }

    private static boolean isWholeNumber(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short;
    }
}
