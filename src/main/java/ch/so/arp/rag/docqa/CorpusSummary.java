package ch.so.arp.rag.docqa;

import java.util.List;

public record CorpusSummary(String fingerprint, List<String> documents, int chunks, int dimension) {

    static CorpusSummary of(IndexedDocument corpus) {
        List<String> sources = corpus.metadata().chunks().stream().map(Chunk::source).distinct().toList();
        return new CorpusSummary(corpus.fingerprint(), sources, corpus.size(), corpus.index().dimension());
    }
}
