package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, oldest-first history of conversation turns. Instances are immutable;
 * every modification returns a new window. A window of {@code W} exchanges
 * keeps at most {@code 2W} turns.
 */
public final class ConversationWindow {

    private static final ConversationWindow EMPTY = new ConversationWindow(List.of());

    private final List<ConversationTurn> turns;

    private ConversationWindow(List<ConversationTurn> turns) {
        this.turns = List.copyOf(turns);
    }

    public static ConversationWindow empty() {
        return EMPTY;
    }

    public static ConversationWindow of(List<ConversationTurn> turns) {
        return new ConversationWindow(Objects.requireNonNull(turns, "turns"));
    }

    public ConversationWindow appendTurn(ConversationRole role, String content) {
        List<ConversationTurn> appended = new ArrayList<>(turns.size() + 1);
        appended.addAll(turns);
        appended.add(new ConversationTurn(role, content));
        return new ConversationWindow(appended);
    }

    /**
     * Keeps the most recent {@code 2 * windowExchanges} turns.
     */
    public ConversationWindow trim(int windowExchanges) {
        if (windowExchanges < 1) {
            throw new IllegalArgumentException("windowExchanges must be at least 1 (was " + windowExchanges + ")");
        }
        int maxTurns = 2 * windowExchanges;
        if (turns.size() <= maxTurns) {
            return this;
        }
        return new ConversationWindow(turns.subList(turns.size() - maxTurns, turns.size()));
    }

    /**
     * Appends the question and its answer, then trims to the window size.
     */
    public ConversationWindow recordExchange(String question, String answer, int windowExchanges) {
        return appendTurn(ConversationRole.USER, question)
                .appendTurn(ConversationRole.ASSISTANT, answer)
                .trim(windowExchanges);
    }

    public List<ConversationTurn> turns() {
        return turns;
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    @Override
    public String toString() {
        return "ConversationWindow[turns=" + turns.size() + "]";
    }
}
