package io.turnstile.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.turnstile.core.model.ChatMessage;
import io.turnstile.core.model.MessageRole;
import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HistoryManagerTest {

    private final HistoryManager history = new HistoryManager();
    private Session session;

    @BeforeEach
    void setUp() {
        session = new Session("s-1", Instant.EPOCH, "You are helpful.");
        session.lock().lock();
    }

    @AfterEach
    void tearDown() {
        session.lock().unlock();
    }

    @Test
    void shouldKeepSystemMessageAndNewestMessagesWhenTruncating() {
        for (int i = 0; i < 150; i++) {
            history.append(session, ChatMessage.user("message " + i));
        }

        int removed = history.truncate(session, 100);

        assertThat(removed).isEqualTo(51);
        assertThat(session.size()).isEqualTo(100);
        assertThat(session.messages().get(0).role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(session.messages().get(1)).isEqualTo(ChatMessage.user("message 51"));
        assertThat(session.messages().get(99)).isEqualTo(ChatMessage.user("message 149"));
    }

    @Test
    void shouldLeaveShortHistoryUntouched() {
        history.append(session, ChatMessage.user("hi"));

        assertThat(history.truncate(session, 100)).isZero();
        assertThat(session.size()).isEqualTo(2);
    }

    @Test
    void shouldKeepAtLeastOneMessageBesideSystemPrompt() {
        history.append(session, ChatMessage.user("first"));
        history.append(session, ChatMessage.assistant("reply"));
        history.append(session, ChatMessage.user("second"));

        history.truncate(session, 1);

        assertThat(session.messages()).containsExactly(ChatMessage.system("You are helpful."), ChatMessage.user("second"));
    }

    @Test
    void shouldDropToolResultsOrphanedAtTheHead() {
        history.append(session, ChatMessage.user("analyze"));
        history.append(session, ChatMessage.assistant("calling tools"));
        history.append(session, ChatMessage.tool("result a", "call_a"));
        history.append(session, ChatMessage.tool("result b", "call_b"));
        history.append(session, ChatMessage.assistant("summary"));

        int removed = history.truncate(session, 4);

        assertThat(removed).isEqualTo(4);
        assertThat(session.messages()).containsExactly(ChatMessage.system("You are helpful."), ChatMessage.assistant("summary"));
    }

    @Test
    void shouldRestoreCheckpointOnRollback() {
        history.append(session, ChatMessage.user("kept"));
        HistoryCheckpoint checkpoint = history.checkpoint(session);
        history.append(session, ChatMessage.user("discarded"));
        history.append(session, ChatMessage.assistant("also discarded"));

        history.rollback(session, checkpoint);

        assertThat(session.messages()).containsExactly(ChatMessage.system("You are helpful."), ChatMessage.user("kept"));
    }

    @Test
    void shouldRejectNonPositiveBound() {
        assertThatThrownBy(() -> history.truncate(session, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRefuseModificationWithoutLock() {
        Session unlocked = new Session("s-2", Instant.EPOCH, "");

        assertThatThrownBy(() -> history.append(unlocked, ChatMessage.user("hi")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be locked");
    }
}
