package com.openforge.agentchat.agent.dto;

import com.openforge.agentchat.domain.MessageContent;
import com.openforge.agentchat.domain.MessageType;

import java.util.List;

/**
 * Final answer to one query.
 *
 * @param responseType   ASSISTANT, or ERROR when the pipeline aborted
 * @param toolsUsed      tools the classifier suggested; empty on error
 * @param processingTime seconds from receipt to answer (or to the failure)
 */
public record AgentResponse(
        String messageId,
        MessageType responseType,
        List<MessageContent> content,
        List<String> toolsUsed,
        double processingTime,
        String sessionId
) {}
