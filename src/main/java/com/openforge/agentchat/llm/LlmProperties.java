package com.openforge.agentchat.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised LLM provider configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix:
 *
 * agent:
 *   llm:
 *     primary:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: ${OPENAI_API_KEY:}
 *       model: gpt-3.5-turbo
 *       timeout-seconds: 60
 *       max-tokens: 2000
 *       temperature: 0.7
 *     fallback:            # optional
 *       name: deepseek
 *       base-url: https://api.deepseek.com/v1
 *       api-key: ${DEEPSEEK_API_KEY:}
 *       model: deepseek-chat
 *
 * A provider without an API key counts as "not configured".  With no
 * configured primary provider the text generation tool starts disabled and
 * intent classification runs on keyword rules only.
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            @DefaultValue("openai") String name,
            @DefaultValue("https://api.openai.com/v1") String baseUrl,
            String apiKey,
            @DefaultValue("gpt-3.5-turbo") String model,
            @DefaultValue("60") int timeoutSeconds,
            @DefaultValue("2000") int maxTokens,
            @DefaultValue("0.7") double temperature
    ) {

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank()
                    && baseUrl != null && !baseUrl.isBlank();
        }
    }

    public boolean primaryConfigured() {
        return primary != null && primary.isConfigured();
    }

    public boolean fallbackConfigured() {
        return fallback != null && fallback.isConfigured();
    }
}
