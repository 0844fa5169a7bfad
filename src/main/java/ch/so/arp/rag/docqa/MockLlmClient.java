package ch.so.arp.rag.docqa;

import java.util.List;

/**
 * Deterministic {@link LlmClient} used in tests and local development where the
 * OpenAI API should not be contacted. The answer echoes the question and the
 * first line of the context so that callers can see what was retrieved.
 */
class MockLlmClient implements LlmClient {

    static final String PREFIX = "[mocked answer]";

    @Override
    public String generate(List<ConversationTurn> history, String query, String context) {
        StringBuilder answer = new StringBuilder(PREFIX)
                .append(" Question was: ").append(query);
        if (context != null && !context.isBlank()) {
            int lineEnd = context.indexOf('\n');
            answer.append(" | Best match: ").append(lineEnd < 0 ? context : context.substring(0, lineEnd));
        } else {
            answer.append(" | No context available");
        }
        answer.append(" | History turns: ").append(history.size());
        return answer.toString();
    }
}
