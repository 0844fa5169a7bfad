package ch.so.arp.rag.docqa;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class CorpusControllerTest {

    private final CorpusIndexService corpusIndexService = mock(CorpusIndexService.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CorpusController(corpusIndexService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addMappedInterceptors(new String[] { "/api/corpus/**" }, new ApiKeyInterceptor(() -> "secret"))
                .build();
    }

    @Test
    void indexesFolder() throws Exception {
        when(corpusIndexService.indexFolder(Path.of("/data/policies")))
                .thenReturn(new CorpusSummary("/data/policies", List.of("a.pdf", "b.pdf"), 12, 384));

        mockMvc.perform(post("/api/corpus/index")
                .header(HttpHeaders.AUTHORIZATION, "Bearer secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"folder\": \"/data/policies\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documents[1]").value("b.pdf"))
                .andExpect(jsonPath("$.chunks").value(12));
    }

    @Test
    void searchesWithFilterAndDefaultK() throws Exception {
        when(corpusIndexService.search(eq("grace period"), eq(3),
                eq(new RetrievalFilter("policy.pdf", null, 2, 4))))
                .thenReturn(List.of(new RankedChunk("grace period is thirty days", "policy.pdf", 2, "4.1", 0.83d)));

        mockMvc.perform(post("/api/corpus/search")
                .header(HttpHeaders.AUTHORIZATION, "Bearer secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"grace period\", \"source\": \"policy.pdf\", \"pageFrom\": 2, \"pageTo\": 4}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].page").value(2))
                .andExpect(jsonPath("$[0].clauseNumber").value("4.1"))
                .andExpect(jsonPath("$[0].score").value(0.83d));
    }

    @Test
    void invertedPageRangeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/corpus/search")
                .header(HttpHeaders.AUTHORIZATION, "Bearer secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"grace\", \"pageFrom\": 4, \"pageTo\": 2}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rejectsKBelowOne() throws Exception {
        mockMvc.perform(post("/api/corpus/search")
                .header(HttpHeaders.AUTHORIZATION, "Bearer secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"grace\", \"k\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ApiError.INVALID_REQUEST));
    }

    @Test
    void searchBeforeIndexingIsNotFound() throws Exception {
        when(corpusIndexService.search(anyString(), anyInt(), any())).thenThrow(new CorpusNotIndexedException());

        mockMvc.perform(post("/api/corpus/search")
                .header(HttpHeaders.AUTHORIZATION, "Bearer secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"grace\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ApiError.CORPUS_NOT_INDEXED));
    }

    @Test
    void requiresApiKey() throws Exception {
        mockMvc.perform(post("/api/corpus/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"grace\"}"))
                .andExpect(status().isUnauthorized());
    }
}
