package com.openforge.agentchat.agent;

import com.openforge.agentchat.agent.dto.AgentResponse;
import com.openforge.agentchat.agent.dto.UserQuery;
import com.openforge.agentchat.config.AgentProperties;
import com.openforge.agentchat.domain.ChatMessage;
import com.openforge.agentchat.domain.MessageContent;
import com.openforge.agentchat.domain.MessageType;
import com.openforge.agentchat.intent.ConversationTurn;
import com.openforge.agentchat.intent.IntentClassification;
import com.openforge.agentchat.intent.IntentClassifier;
import com.openforge.agentchat.session.SessionStats;
import com.openforge.agentchat.session.SessionStore;
import com.openforge.agentchat.tool.ToolRegistry;
import com.openforge.agentchat.tool.ToolRequest;
import com.openforge.agentchat.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one query through the pipeline:
 *
 *   received
 *     → session resolved        (session created or counted, user message appended)
 *     → intent classified       (IntentClassifier, with recent history)
 *     → tools dispatched        (ToolRegistry.executeMany, one request per suggestion with parameters)
 *     → response formatted      (ResponseFormatter, assistant message appended)
 *     → delivered | errored
 *
 * Progress checkpoints: 0.1 analyzing, 0.3 classified, 0.5 executing,
 * 0.8 processing, 1.0 ready.
 *
 * Any exception aborts into an ERROR response.  The user message stays in
 * history; nothing is retried.
 */
@Slf4j
@Service
public class AgentOrchestrator {

    private final SessionStore      sessionStore;
    private final IntentClassifier  intentClassifier;
    private final ToolRegistry      toolRegistry;
    private final ResponseFormatter responseFormatter;
    private final int               historyWindow;

    public AgentOrchestrator(SessionStore sessionStore,
                             IntentClassifier intentClassifier,
                             ToolRegistry toolRegistry,
                             ResponseFormatter responseFormatter,
                             AgentProperties properties) {
        this.sessionStore      = sessionStore;
        this.intentClassifier  = intentClassifier;
        this.toolRegistry      = toolRegistry;
        this.responseFormatter = responseFormatter;
        this.historyWindow     = properties.classifier().historyWindow();
    }

    // ── Pipeline ─────────────────────────────────────────────────────────────

    public AgentResponse processQuery(UserQuery query) {
        return processQuery(query, ProgressListener.NOOP);
    }

    public AgentResponse processQuery(UserQuery query, ProgressListener listener) {
        long   start     = System.nanoTime();
        String sessionId = query.sessionId() != null && !query.sessionId().isBlank()
                ? query.sessionId()
                : UUID.randomUUID().toString();
        String messageId = UUID.randomUUID().toString();
        ProgressListener progress = listener != null ? listener : ProgressListener.NOOP;

        try {
            sessionStore.touch(sessionId);
            sessionStore.append(sessionId, ChatMessage.user(query.message(), sessionId, query.userId()));
            report(progress, sessionId, "Analyzing your request...", 0.1);

            IntentClassification classification =
                    intentClassifier.classify(query.message(), conversationContext(sessionId));
            log.info("[Orchestrator] Session {} intent={} confidence={} tools={}",
                    sessionId, classification.intent(), classification.confidence(),
                    classification.suggestedTools());
            report(progress, sessionId, "Intent classified: " + classification.intent(), 0.3);

            List<ToolResult> results = List.of();
            if (!classification.suggestedTools().isEmpty()) {
                report(progress, sessionId, "Executing tools...", 0.5);
                List<ToolRequest> requests = toolRequests(classification);
                if (!requests.isEmpty()) {
                    results = toolRegistry.executeMany(requests);
                }
                report(progress, sessionId, "Processing results...", 0.8);
            }

            List<MessageContent> content = responseFormatter.format(classification, results, query.message());
            sessionStore.append(sessionId, ChatMessage.assistant(messageId, content, sessionId, results));
            report(progress, sessionId, "Response ready!", 1.0);

            double elapsed = secondsSince(start);
            log.info("[Orchestrator] Session {} answered in {}s", sessionId, String.format("%.2f", elapsed));
            return new AgentResponse(messageId, MessageType.ASSISTANT, content,
                    classification.suggestedTools(), elapsed, sessionId);

        } catch (Exception e) {
            log.error("[Orchestrator] Pipeline failed for session {}: {}", sessionId, e.getMessage(), e);
            MessageContent error = MessageContent.error(
                    "I encountered an error processing your request: " + e.getMessage(),
                    Map.of("error_type", e.getClass().getSimpleName()));
            return new AgentResponse(messageId, MessageType.ERROR, List.of(error), List.of(),
                    secondsSince(start), sessionId);
        }
    }

    // ── Session access ───────────────────────────────────────────────────────

    public List<ChatMessage> sessionHistory(String sessionId) {
        return sessionStore.history(sessionId);
    }

    public List<String> activeSessions() {
        return sessionStore.activeSessions();
    }

    public Optional<SessionStats> sessionStats(String sessionId) {
        return sessionStore.stats(sessionId);
    }

    public boolean clearSession(String sessionId) {
        return sessionStore.clear(sessionId);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<ConversationTurn> conversationContext(String sessionId) {
        return sessionStore.recent(sessionId, historyWindow).stream()
                .map(m -> new ConversationTurn(m.type().value(), m.primaryContent(), m.timestamp()))
                .toList();
    }

    /** Suggestions without a parameter entry are skipped. */
    private static List<ToolRequest> toolRequests(IntentClassification classification) {
        List<ToolRequest> requests = new ArrayList<>();
        for (String tool : classification.suggestedTools()) {
            Map<String, Object> params = classification.parameters().get(tool);
            if (params != null) {
                requests.add(new ToolRequest(tool, params));
            }
        }
        return requests;
    }

    private static void report(ProgressListener listener, String sessionId, String message, double progress) {
        try {
            listener.onProgress(new ProgressUpdate(message, progress, sessionId));
        } catch (Exception e) {
            log.warn("[Orchestrator] Progress delivery failed for session {}: {}", sessionId, e.getMessage());
        }
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
