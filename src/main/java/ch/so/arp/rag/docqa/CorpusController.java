package ch.so.arp.rag.docqa;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoints for indexing a folder of PDFs and searching it.
 */
@RestController
@RequestMapping(path = "/api/corpus", produces = MediaType.APPLICATION_JSON_VALUE,
        consumes = MediaType.APPLICATION_JSON_VALUE)
public class CorpusController {

    private final CorpusIndexService corpusIndexService;

    public CorpusController(CorpusIndexService corpusIndexService) {
        this.corpusIndexService = corpusIndexService;
    }

    @PostMapping("/index")
    public CorpusSummary index(@Valid @RequestBody CorpusIndexRequest request) {
        Path folder;
        try {
            folder = Path.of(request.folder().trim());
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException("Invalid folder: " + request.folder(), ex);
        }
        return corpusIndexService.indexFolder(folder);
    }

    @PostMapping("/search")
    public List<RankedChunk> search(@Valid @RequestBody CorpusSearchRequest request) {
        return corpusIndexService.search(request.query(), request.effectiveK(), request.toFilter());
    }
}
