package com.openforge.agentchat.session;

import com.openforge.agentchat.domain.ChatMessage;
import com.openforge.agentchat.domain.MessageContent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class SessionStoreTest {

    private final SessionStore store = new SessionStore();

    @Test
    void touch_shouldCreateSessionOnFirstUseAndCountMessages() {
        SessionInfo first  = store.touch("s-1");
        SessionInfo second = store.touch("s-1");

        assertThat(first.messageCount()).isEqualTo(1);
        assertThat(second.messageCount()).isEqualTo(2);
        assertThat(second.createdAt()).isEqualTo(first.createdAt());
        assertThat(store.activeSessions()).containsExactly("s-1");
    }

    @Test
    void history_shouldKeepAppendOrderAndReturnCopies() {
        // Given
        store.touch("s-1");
        store.append("s-1", ChatMessage.user("one", "s-1", null));
        store.append("s-1", ChatMessage.assistant("a-1", List.of(MessageContent.text("two")), "s-1", null));

        // When
        List<ChatMessage> history = store.history("s-1");
        store.append("s-1", ChatMessage.user("three", "s-1", null));

        // Then
        assertThat(history).extracting(ChatMessage::primaryContent).containsExactly("one", "two");
        assertThat(store.recent("s-1", 2)).extracting(ChatMessage::primaryContent).containsExactly("two", "three");
        assertThat(store.recent("s-1", 10)).hasSize(3);
    }

    @Test
    void stats_shouldReportLengthAndLastActivity() {
        store.touch("s-1");
        ChatMessage message = ChatMessage.user("hi", "s-1", "u-1");
        store.append("s-1", message);

        assertThat(store.stats("s-1")).hasValueSatisfying(stats -> {
            assertThat(stats.sessionId()).isEqualTo("s-1");
            assertThat(stats.messageCount()).isEqualTo(1);
            assertThat(stats.conversationLength()).isEqualTo(1);
            assertThat(stats.lastActivity()).isEqualTo(message.timestamp());
        });
    }

    @Test
    void clear_shouldRemoveMetadataAndHistory() {
        // Given
        store.touch("s-1");
        store.append("s-1", ChatMessage.user("hi", "s-1", null));

        // When
        boolean cleared = store.clear("s-1");

        // Then
        assertThat(cleared).isTrue();
        assertThat(store.stats("s-1")).isEmpty();
        assertThat(store.history("s-1")).isEmpty();
        assertThat(store.exists("s-1")).isFalse();
        assertThat(store.clear("s-1")).isFalse();
    }

    @Test
    void appendAfterClear_shouldBeDropped() {
        store.touch("s-1");
        store.clear("s-1");

        store.append("s-1", ChatMessage.user("late", "s-1", null));

        assertThat(store.exists("s-1")).isFalse();
        assertThat(store.history("s-1")).isEmpty();
    }

    @Test
    void concurrentTouches_shouldNotLoseUpdates() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < 8; t++) {
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 100; i++) {
                    store.touch("shared");
                    store.append("shared", ChatMessage.user("m", "shared", null));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) f.get();
        pool.shutdown();

        // Then
        assertThat(store.stats("shared")).hasValueSatisfying(stats -> {
            assertThat(stats.messageCount()).isEqualTo(800);
            assertThat(stats.conversationLength()).isEqualTo(800);
        });
    }
}
