package ch.so.arp.rag.docqa;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@link LlmClient} backed by the OpenAI chat completions endpoint. The request
 * carries a fixed system prompt, the conversation history, the retrieved
 * context as a second system message and finally the question.
 */
class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    static final String SYSTEM_PROMPT = "You are a helpful assistant that answers based on provided policy documents.";
    static final int MAX_TOKENS = 512;

    private final OpenAiApi api;

    OpenAiLlmClient(OpenAiApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    @Override
    public String generate(List<ConversationTurn> history, String query, String context) {
        ObjectNode body = buildRequestBody(history, query, context);
        LOGGER.debug("Requesting completion from model {} with {} history turns", api.properties().getModel(),
                history.size());
        JsonNode response;
        try {
            response = api.post("/chat/completions", body);
        } catch (IOException ex) {
            throw new GenerationException("Chat completion failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for the chat completion", ex);
        }
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new GenerationException("Chat completion response contained no answer");
        }
        return content.asText().strip();
    }

    ObjectNode buildRequestBody(List<ConversationTurn> history, String query, String context) {
        ObjectNode body = api.objectMapper().createObjectNode();
        body.put("model", api.properties().getModel());
        body.put("max_tokens", MAX_TOKENS);
        body.put("temperature", 0.0d);
        ArrayNode messages = body.putArray("messages");
        addMessage(messages, "system", SYSTEM_PROMPT);
        for (ConversationTurn turn : history) {
            addMessage(messages, turn.role().apiName(), turn.content());
        }
        if (context != null && !context.isBlank()) {
            addMessage(messages, "system", "CONTEXT:\n" + context);
        }
        addMessage(messages, ConversationRole.USER.apiName(), query);
        return body;
    }

    private static void addMessage(ArrayNode messages, String role, String content) {
        messages.addObject().put("role", role).put("content", content);
    }
}
