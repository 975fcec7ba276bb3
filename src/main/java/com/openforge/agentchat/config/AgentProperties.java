package com.openforge.agentchat.config;

import com.openforge.agentchat.llm.LlmProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Application-level settings, read from application.yml under "agent":
 *
 * agent:
 *   app:
 *     name: Agentic Chat Assistant
 *     version: 1.0.0
 *     debug: false
 *     cors-origins: http://localhost:3000,http://localhost:5173
 *   tools:
 *     pool-size: 8
 *     timeout-seconds: 150
 *   classifier:
 *     temperature: 0.3
 *     max-tokens: 500
 *     history-window: 5
 *
 * The LLM providers live under "agent.llm" and are bound separately
 * (see LlmProperties).
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(
        @DefaultValue App app,
        @DefaultValue Tools tools,
        @DefaultValue Classifier classifier
) {

    public record App(
            @DefaultValue("Agentic Chat Assistant") String name,
            @DefaultValue("1.0.0") String version,
            @DefaultValue("false") boolean debug,
            @DefaultValue({"http://localhost:3000", "http://localhost:5173"}) List<String> corsOrigins
    ) {}

    /**
     * timeoutSeconds must be at least the primary provider's timeout plus the
     * fallback provider's, since text_generation may wait on both in one run.
     * A shorter value reports slow but healthy LLM calls as FAILED while their
     * threads keep running.
     *
     * @param poolSize       threads in the tool fan-out pool
     * @param timeoutSeconds upper bound for a single tool run inside a batch,
     *                       counted from the start of the run
     */
    public record Tools(
            @DefaultValue("8") int poolSize,
            @DefaultValue("150") int timeoutSeconds
    ) {

        /** Seconds a tool run may spend waiting on the configured providers. */
        public static int llmBudgetSeconds(LlmProperties llm) {
            int budget = llm.primaryConfigured() ? llm.primary().timeoutSeconds() : 0;
            if (llm.fallbackConfigured()) budget += llm.fallback().timeoutSeconds();
            return budget;
        }

        public boolean coversLlmCalls(LlmProperties llm) {
            return timeoutSeconds >= llmBudgetSeconds(llm);
        }
    }

    /**
     * @param historyWindow number of most recent history entries handed to the classifier
     */
    public record Classifier(
            @DefaultValue("0.3") double temperature,
            @DefaultValue("500") int maxTokens,
            @DefaultValue("5") int historyWindow
    ) {}
}
