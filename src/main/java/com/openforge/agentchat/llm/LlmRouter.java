package com.openforge.agentchat.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.agentchat.llm.model.ChatRequest;
import com.openforge.agentchat.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * Routes chat completions to the configured providers.
 *
 * Call graph:
 *
 *   chat(request)
 *     └─ primaryCircuitBreaker
 *           └─ primaryClient.chat(request)
 *                 ↓ (on CallNotPermittedException or any exception, if a fallback exists)
 *     └─ fallbackCircuitBreaker
 *           └─ fallbackClient.chat(request)
 *
 * A provider without an API key is never called.  With neither provider
 * configured {@link #isConfigured()} is false and chat() fails fast.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmRouter {

    private final LlmClient      primaryClient;
    private final LlmClient      fallbackClient;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;

    public LlmRouter(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties properties,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker) {
        this.primaryClient  = properties.primaryConfigured()
                ? new LlmClient(httpClient, objectMapper, properties.primary()) : null;
        this.fallbackClient = properties.fallbackConfigured()
                ? new LlmClient(httpClient, objectMapper, properties.fallback()) : null;
        this.primaryCb      = primaryLlmCircuitBreaker;
        this.fallbackCb     = fallbackLlmCircuitBreaker;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** True when at least the primary provider has credentials. */
    public boolean isConfigured() {
        return primaryClient != null;
    }

    /** Model the primary provider uses when a request names none. */
    public String defaultModel() {
        return primaryClient != null ? primaryClient.modelName() : null;
    }

    /**
     * Route a chat request through primary → fallback.
     *
     * The request's own model is kept for the primary provider; when the
     * fallback takes over, the model is replaced by the fallback's configured
     * one since model names rarely carry across providers.
     */
    public ChatResponse chat(ChatRequest request) {
        if (primaryClient == null) {
            throw new LlmClient.LlmException("No LLM provider configured");
        }
        try {
            return executeWithBreaker(primaryCb, () -> primaryClient.chat(request), "primary");
        } catch (LlmClient.LlmException primaryException) {
            if (fallbackClient == null) {
                throw primaryException;
            }
            log.warn("[LlmRouter] Primary provider failed ({}), engaging fallback. Cause: {}",
                    primaryException.getClass().getSimpleName(), primaryException.getMessage());

            ChatRequest fallbackRequest = request.toBuilder().model(fallbackClient.modelName()).build();
            return executeWithBreaker(fallbackCb, () -> fallbackClient.chat(fallbackRequest), "fallback");
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates a supplier with the provider's circuit breaker, then executes it.
     * Programmatic decoration, no AOP proxies.
     */
    private ChatResponse executeWithBreaker(CircuitBreaker cb,
                                            Supplier<ChatResponse> call,
                                            String label) {
        Supplier<ChatResponse> decorated = CircuitBreaker.decorateSupplier(cb, call);
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new LlmClient.LlmException(
                    "[LlmRouter] %s provider failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
