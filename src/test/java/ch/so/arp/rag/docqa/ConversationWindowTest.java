package ch.so.arp.rag.docqa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ConversationWindowTest {

    @Test
    void keepsLastTwoTurnsPerExchange() {
        ConversationWindow window = ConversationWindow.empty();
        for (int i = 0; i < 10; i++) {
            window = window.appendTurn(i % 2 == 0 ? ConversationRole.USER : ConversationRole.ASSISTANT, "turn-" + i);
        }

        ConversationWindow trimmed = window.trim(3);

        assertThat(trimmed.turns()).extracting(ConversationTurn::content)
                .containsExactly("turn-4", "turn-5", "turn-6", "turn-7", "turn-8", "turn-9");
        assertThat(window.size()).isEqualTo(10);
    }

    @Test
    void recordExchangeAppendsQuestionAndAnswer() {
        ConversationWindow window = ConversationWindow.empty()
                .recordExchange("q1", "a1", 1)
                .recordExchange("q2", "a2", 1);

        assertThat(window.turns()).containsExactly(ConversationTurn.user("q2"), ConversationTurn.assistant("a2"));
    }

    @Test
    void shortWindowIsUnchangedByTrim() {
        ConversationWindow window = ConversationWindow.empty().recordExchange("q", "a", 3);

        assertThat(window.trim(3)).isSameAs(window);
    }

    @Test
    void rejectsWindowSmallerThanOne() {
        assertThatThrownBy(() -> ConversationWindow.empty().trim(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rolesUseChatApiNames() {
        assertThat(ConversationRole.USER.apiName()).isEqualTo("user");
        assertThat(ConversationRole.ASSISTANT.apiName()).isEqualTo("assistant");
    }
}
