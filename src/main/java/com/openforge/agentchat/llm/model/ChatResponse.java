package com.openforge.agentchat.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Convenience: first choice message (always present for non-streaming responses). */
    public Message firstMessage() {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("LLM returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    public String firstContent() {
        Message message = firstMessage();
        return message == null ? null : message.content();
    }

    public String finishReason() {
        if (choices == null || choices.isEmpty()) return null;
        return choices.get(0).finishReason();
    }

    /** Null when the provider did not report usage. */
    public Integer totalTokens() {
        return usage == null ? null : usage.totalTokens();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
