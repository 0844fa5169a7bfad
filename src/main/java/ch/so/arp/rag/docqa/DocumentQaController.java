package ch.so.arp.rag.docqa;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoints for answering questions about a remote document.
 */
@RestController
@RequestMapping(path = "/api", produces = MediaType.APPLICATION_JSON_VALUE)
public class DocumentQaController {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentQaController.class);

    private final DocumentQuestionService questionService;

    public DocumentQaController(DocumentQuestionService questionService) {
        this.questionService = questionService;
    }

    @PostMapping(path = "/process-pdf", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ProcessDocumentResponse processDocument(@Valid @RequestBody ProcessDocumentRequest request) {
        LOGGER.info("Received {} question(s) for {}", request.questions().size(), request.documents());
        List<QuestionAnswer> answers = questionService.answerAll(request.documents(), request.questions());
        return new ProcessDocumentResponse(answers);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
