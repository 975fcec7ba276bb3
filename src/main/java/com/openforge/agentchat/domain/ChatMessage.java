package com.openforge.agentchat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.agentchat.tool.ToolResult;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One entry of a session's conversation history.
 *
 * toolResults is present only on assistant messages produced after tool
 * execution; it keeps the raw results next to the formatted content.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        String id,
        MessageType type,
        List<MessageContent> content,
        Instant timestamp,
        String userId,
        String sessionId,
        List<ToolResult> toolResults
) {

    public ChatMessage {
        content = content == null ? List.of() : List.copyOf(content);
        toolResults = toolResults == null ? null : List.copyOf(toolResults);
        if (timestamp == null) timestamp = Instant.now();
    }

    public static ChatMessage user(String text, String sessionId, String userId) {
        return ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .type(MessageType.USER)
                .content(List.of(MessageContent.text(text)))
                .sessionId(sessionId)
                .userId(userId)
                .build();
    }

    public static ChatMessage assistant(String id, List<MessageContent> content,
                                        String sessionId, List<ToolResult> toolResults) {
        return ChatMessage.builder()
                .id(id)
                .type(MessageType.ASSISTANT)
                .content(content)
                .sessionId(sessionId)
                .toolResults(toolResults)
                .build();
    }

    /** Text of the first content block, or "" for an empty message. */
    public String primaryContent() {
        return content.isEmpty() ? "" : content.get(0).contentAsText();
    }
}
