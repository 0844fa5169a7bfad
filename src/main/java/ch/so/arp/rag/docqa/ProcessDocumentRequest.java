package ch.so.arp.rag.docqa;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;

/**
 * Incoming payload for question answering: a document URL and the questions
 * to answer about it.
 */
public record ProcessDocumentRequest(
        @NotBlank @Pattern(regexp = "(?i)https?://\\S+", message = "must be an http(s) URL") String documents,
        @NotEmpty List<@NotBlank String> questions) {
}
