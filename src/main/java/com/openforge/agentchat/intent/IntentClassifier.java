package com.openforge.agentchat.intent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentchat.config.AgentProperties;
import com.openforge.agentchat.llm.LlmRouter;
import com.openforge.agentchat.llm.model.ChatRequest;
import com.openforge.agentchat.llm.model.ChatResponse;
import com.openforge.agentchat.llm.model.Message;
import com.openforge.agentchat.tool.ToolDefinition;
import com.openforge.agentchat.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps a user message to an {@link IntentClassification}.
 *
 * With an LLM configured the message, the tool catalogue and the recent
 * conversation go to the model, which answers in JSON.  Without one, or when
 * the call or the parsing fails, ordered keyword rules decide.  Either way the
 * result names at least one tool and carries parameters for each.
 */
@Slf4j
@Service
public class IntentClassifier {

    static final String DEFAULT_TOOL = "text_generation";

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {};

    /** Checked in order; the first rule with a matching keyword wins. */
    private static final List<KeywordRule> KEYWORD_RULES = List.of(
            new KeywordRule(IntentCategory.CODE_GENERATION, 0.7, "Help with coding: ",
                    "Detected code-related keywords",
                    "code", "program", "function", "script", "debug"),
            new KeywordRule(IntentCategory.WEB_SEARCH, 0.6, "Provide information about: ",
                    "Detected search-related keywords",
                    "search", "find", "what is", "current", "news", "latest"),
            new KeywordRule(IntentCategory.IMAGE_GENERATION, 0.8, "Describe image generation request: ",
                    "Detected image-related keywords",
                    "image", "picture", "draw", "create visual", "generate image"),
            new KeywordRule(IntentCategory.CALCULATION, 0.7, "Help with calculation: ",
                    "Detected calculation-related keywords",
                    "calculate", "math", "compute", "solve", "equation"));

    private final LlmRouter    router;
    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;
    private final AgentProperties.Classifier settings;

    public IntentClassifier(LlmRouter router,
                            ToolRegistry toolRegistry,
                            ObjectMapper objectMapper,
                            AgentProperties properties) {
        this.router       = router;
        this.toolRegistry = toolRegistry;
        this.objectMapper = objectMapper;
        this.settings     = properties.classifier();
        if (!router.isConfigured()) {
            log.warn("[IntentClassifier] No LLM configured, using keyword classification");
        }
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public IntentClassification classify(String message) {
        return classify(message, List.of());
    }

    /**
     * Classify a message in the light of the conversation so far.
     *
     * @param history most recent last; only the tail of
     *                agent.classifier.history-window entries is used
     */
    public IntentClassification classify(String message, List<ConversationTurn> history) {
        if (!router.isConfigured()) {
            return fallbackClassification(message);
        }
        try {
            IntentClassification classification = classifyWithLlm(message, buildContext(history));
            log.debug("[IntentClassifier] LLM classified as {} ({})",
                    classification.intent(), classification.confidence());
            return classification;
        } catch (Exception e) {
            log.warn("[IntentClassifier] Classification failed, falling back to keywords: {}", e.getMessage());
            return fallbackClassification(message);
        }
    }

    public List<String> availableIntents() {
        return Arrays.stream(IntentCategory.values()).map(IntentCategory::value).toList();
    }

    // ── LLM path ─────────────────────────────────────────────────────────────

    private IntentClassification classifyWithLlm(String message, Map<String, Object> context) throws Exception {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(buildSystemPrompt()));
        messages.add(Message.user("Classify this query: " + message));
        if (!context.isEmpty()) {
            messages.add(Message.user("Additional context: "
                    + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context)));
        }

        ChatResponse response = router.chat(
                ChatRequest.jsonObject(messages, settings.maxTokens(), settings.temperature()));
        String content = response.firstContent();
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("empty classification response");
        }
        return parse(objectMapper.readTree(content), message);
    }

    /** Read the model's JSON; absent or mistyped fields take their defaults. */
    IntentClassification parse(JsonNode node, String message) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("classification is not a JSON object");
        }

        String intent = node.path("intent").isTextual() && !node.path("intent").asText().isBlank()
                ? node.path("intent").asText()
                : IntentCategory.TEXT_GENERATION.value();

        double confidence = node.path("confidence").isNumber()
                ? Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble()))
                : 0.5;

        List<String> tools = new ArrayList<>();
        if (node.path("suggested_tools").isArray()) {
            node.path("suggested_tools").forEach(t -> {
                if (t.isTextual() && !t.asText().isBlank()) tools.add(t.asText());
            });
        }

        Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
        if (node.path("parameters").isObject()) {
            node.path("parameters").fields().forEachRemaining(entry -> {
                if (entry.getValue().isObject()) {
                    parameters.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), PARAMS_TYPE));
                }
            });
        }

        String reasoning = node.path("reasoning").isTextual()
                ? node.path("reasoning").asText()
                : "Default classification";

        return repaired(intent, confidence, tools, parameters, reasoning, message);
    }

    /**
     * Drop suggestions the model gave no parameters for, except the default
     * tool, which gets the message as its prompt.  An empty list becomes the
     * default tool alone.
     */
    private static IntentClassification repaired(String intent, double confidence, List<String> tools,
                                                 Map<String, Map<String, Object>> parameters,
                                                 String reasoning, String message) {
        List<String> kept = new ArrayList<>();
        for (String tool : tools) {
            if (kept.contains(tool)) continue;
            if (parameters.containsKey(tool)) {
                kept.add(tool);
            } else if (DEFAULT_TOOL.equals(tool)) {
                parameters.put(tool, promptOnly(message));
                kept.add(tool);
            } else {
                log.debug("[IntentClassifier] Dropping suggested tool '{}' without parameters", tool);
            }
        }
        if (kept.isEmpty()) {
            kept.add(DEFAULT_TOOL);
            parameters.putIfAbsent(DEFAULT_TOOL, promptOnly(message));
        }
        return new IntentClassification(intent, confidence, kept, parameters, reasoning);
    }

    private String buildSystemPrompt() {
        List<ToolDefinition> definitions = toolRegistry.definitions();
        String toolsList = definitions.isEmpty()
                ? "- text_generation: Generate text responses using AI language models (Category: ai)"
                : definitions.stream()
                        .map(d -> "- %s: %s (Category: %s)".formatted(d.name(), d.description(), d.category()))
                        .collect(Collectors.joining("\n"));
        String intentsList = Arrays.stream(IntentCategory.values())
                .map(c -> "- %s: %s".formatted(c.value(), c.description()))
                .collect(Collectors.joining("\n"));

        return """
                You are an intelligent intent classifier for an agentic chat assistant. Your job is to analyze user queries and determine:

                1. The primary intent of the user
                2. Which tools should be used to fulfill the request
                3. What parameters should be passed to those tools

                Available Tools:
                %s

                Intent Categories:
                %s

                Response Format:
                You must respond with a valid JSON object containing:
                {
                    "intent": "primary_intent_category",
                    "confidence": 0.0-1.0,
                    "suggested_tools": ["tool1", "tool2"],
                    "parameters": {
                        "tool1": {"param1": "value1"},
                        "tool2": {"param2": "value2"}
                    },
                    "reasoning": "Brief explanation of why these tools were selected"
                }

                Rules:
                1. Always suggest at least one tool
                2. If unsure, default to text_generation tool
                3. Confidence should reflect how certain you are about the classification
                4. Parameters should match the tool's expected input format
                5. For text generation, always include the user's query as the "prompt" parameter
                """.formatted(toolsList, intentsList);
    }

    private Map<String, Object> buildContext(List<ConversationTurn> history) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (history == null || history.isEmpty()) {
            return context;
        }
        int window = Math.max(1, settings.historyWindow());
        List<ConversationTurn> recent = history.subList(Math.max(0, history.size() - window), history.size());
        context.put("recent_conversation", recent);

        ConversationTurn last = recent.get(recent.size() - 1);
        if ("assistant".equals(last.role())) {
            context.put("last_assistant_response", last.content());
        }
        return context;
    }

    // ── Keyword fallback ─────────────────────────────────────────────────────

    IntentClassification fallbackClassification(String message) {
        String text  = message == null ? "" : message;
        String lower = text.toLowerCase(Locale.ROOT);
        for (KeywordRule rule : KEYWORD_RULES) {
            if (rule.matches(lower)) {
                return single(rule.category().value(), rule.confidence(),
                        rule.promptPrefix() + text, rule.reasoning());
            }
        }
        return single(IntentCategory.TEXT_GENERATION.value(), 0.5, text,
                "Default classification for general text generation");
    }

    private static IntentClassification single(String intent, double confidence, String prompt, String reasoning) {
        Map<String, Map<String, Object>> parameters = new LinkedHashMap<>();
        parameters.put(DEFAULT_TOOL, promptOnly(prompt));
        return new IntentClassification(intent, confidence, List.of(DEFAULT_TOOL), parameters, reasoning);
    }

    private static Map<String, Object> promptOnly(String prompt) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("prompt", prompt);
        return params;
    }

    private record KeywordRule(IntentCategory category, double confidence, String promptPrefix,
                               String reasoning, String... keywords) {

        boolean matches(String lowerCaseText) {
            for (String keyword : keywords) {
                if (lowerCaseText.contains(keyword)) return true;
            }
            return false;
        }
    }
}
