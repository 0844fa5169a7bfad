package ch.so.arp.rag.docqa;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers a batch of questions about one document. The document index is
 * taken from the {@link DocumentIndexCache} (built on first use), context is
 * retrieved per question and the answer generation is delegated to the
 * {@link LlmClient}. Questions of one batch form a conversation whose recent
 * exchanges are passed along as history.
 */
public class DocumentQuestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentQuestionService.class);

    static final String NO_CONTEXT_ANSWER =
            "I could not find relevant information in the document to answer this question.";

    private final DocumentIndexCache cache;
    private final DocumentIndexer indexer;
    private final RetrievalEngine retrievalEngine;
    private final LlmClient llmClient;
    private final int topK;
    private final int windowExchanges;
    private final boolean detectClause;

    public DocumentQuestionService(DocumentIndexCache cache, DocumentIndexer indexer, RetrievalEngine retrievalEngine,
            LlmClient llmClient, int topK, int windowExchanges, boolean detectClause) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.retrievalEngine = Objects.requireNonNull(retrievalEngine, "retrievalEngine");
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
        if (windowExchanges < 1) {
            throw new IllegalArgumentException("windowExchanges must be at least 1");
        }
        this.topK = topK;
        this.windowExchanges = windowExchanges;
        this.detectClause = detectClause;
    }

    /**
     * Answers the questions in order.
     *
     * @throws DownloadException if the document cannot be fetched
     * @throws ExtractionException if the document has no usable text
     * @throws GenerationException if the language model fails
     */
    public List<QuestionAnswer> answerAll(String documentUrl, List<String> questions) {
        Objects.requireNonNull(documentUrl, "documentUrl");
        Objects.requireNonNull(questions, "questions");
        String fingerprint = documentUrl.trim();
        IndexedDocument document = cache.getOrBuild(fingerprint, () -> indexer.index(fingerprint));

        ConversationWindow window = ConversationWindow.empty();
        List<QuestionAnswer> answers = new ArrayList<>(questions.size());
        for (String question : questions) {
            String answer = answer(document, question, window);
            window = window.recordExchange(question, answer, windowExchanges);
            answers.add(new QuestionAnswer(question, answer));
        }
        LOGGER.info("Answered {} question(s) for {}", answers.size(), fingerprint);
        return answers;
    }

    String answer(IndexedDocument document, String question, ConversationWindow window) {
        List<RankedChunk> chunks = retrieve(document, question);
        if (chunks.isEmpty()) {
            LOGGER.debug("No context found for question '{}'", question);
            return NO_CONTEXT_ANSWER;
        }
        return llmClient.generate(window.turns(), question, buildContext(chunks));
    }

    private List<RankedChunk> retrieve(IndexedDocument document, String question) {
        Optional<String> clause = detectClause ? ClauseNumberExtractor.fromQuery(question) : Optional.empty();
        if (clause.isPresent()) {
            List<RankedChunk> filtered = retrievalEngine.retrieve(question, document, topK,
                    RetrievalFilter.byClause(clause.get()));
            if (!filtered.isEmpty()) {
                return filtered;
            }
            LOGGER.warn("No chunk of {} is tagged with clause {}, retrieving without clause filter",
                    document.fingerprint(), clause.get());
        }
        return retrievalEngine.retrieve(question, document, topK);
    }

    static String buildContext(List<RankedChunk> chunks) {
        return chunks.stream().map(RankedChunk::formatForPrompt).collect(Collectors.joining("\n\n"));
    }
}
