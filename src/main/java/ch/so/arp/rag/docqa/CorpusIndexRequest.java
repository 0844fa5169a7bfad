package ch.so.arp.rag.docqa;

import jakarta.validation.constraints.NotBlank;

public record CorpusIndexRequest(@NotBlank String folder) {
}
