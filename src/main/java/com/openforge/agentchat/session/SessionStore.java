package com.openforge.agentchat.session;

import com.openforge.agentchat.domain.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory session metadata and conversation history, keyed by session id.
 *
 * Creating a session is atomic per id; every read or write of one session's
 * state holds that session's monitor, so two queries on the same session
 * never interleave inside a single append.  Nothing survives a restart.
 */
@Slf4j
@Component
public class SessionStore {

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    /**
     * Resolve the session, creating it on first use, and count one more
     * incoming message.
     */
    public SessionInfo touch(String sessionId) {
        SessionState state = sessions.computeIfAbsent(sessionId, id -> {
            log.info("[SessionStore] New session {}", id);
            return new SessionState(id, Instant.now());
        });
        synchronized (state) {
            state.messageCount++;
            return new SessionInfo(state.sessionId, state.createdAt, state.messageCount);
        }
    }

    /** Append to the history.  A message for a cleared or unknown session is dropped. */
    public void append(String sessionId, ChatMessage message) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            log.warn("[SessionStore] Session {} no longer exists, dropping {} message {}",
                    sessionId, message.type().value(), message.id());
            return;
        }
        synchronized (state) {
            state.history.add(message);
        }
    }

    /** Copy of the full history; empty for an unknown session. */
    public List<ChatMessage> history(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) return List.of();
        synchronized (state) {
            return List.copyOf(state.history);
        }
    }

    /** The last {@code limit} history entries, oldest first. */
    public List<ChatMessage> recent(String sessionId, int limit) {
        SessionState state = sessions.get(sessionId);
        if (state == null || limit <= 0) return List.of();
        synchronized (state) {
            int size = state.history.size();
            return List.copyOf(state.history.subList(Math.max(0, size - limit), size));
        }
    }

    public Optional<SessionStats> stats(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) return Optional.empty();
        synchronized (state) {
            Instant lastActivity = state.history.isEmpty()
                    ? null
                    : state.history.get(state.history.size() - 1).timestamp();
            return Optional.of(new SessionStats(state.sessionId, state.createdAt,
                    state.messageCount, state.history.size(), lastActivity));
        }
    }

    public List<String> activeSessions() {
        return new ArrayList<>(sessions.keySet());
    }

    public boolean exists(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /** Remove metadata and history together. */
    public boolean clear(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.info("[SessionStore] Cleared session {}", sessionId);
        }
        return removed;
    }

    private static final class SessionState {
        private final String  sessionId;
        private final Instant createdAt;
        private final List<ChatMessage> history = new ArrayList<>();
        private int messageCount;

        private SessionState(String sessionId, Instant createdAt) {
            this.sessionId = sessionId;
            this.createdAt = createdAt;
        }
    }
}
