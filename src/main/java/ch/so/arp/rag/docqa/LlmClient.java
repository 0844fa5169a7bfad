package ch.so.arp.rag.docqa;

import java.util.List;

/**
 * Abstraction over the language model integration. Implementations can either
 * invoke the real OpenAI API or return predictable responses for testing.
 */
public interface LlmClient {

    /**
     * Generate an answer for the question.
     *
     * @param history previous turns of the conversation, oldest first
     * @param query the current question
     * @param context retrieved document excerpts, may be empty
     * @return the answer text
     * @throws GenerationException if the model could not be reached or returned
     *         no usable answer
     */
    String generate(List<ConversationTurn> history, String query, String context);
}
