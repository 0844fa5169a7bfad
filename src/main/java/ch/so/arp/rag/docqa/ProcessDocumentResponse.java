package ch.so.arp.rag.docqa;

import java.util.List;

public record ProcessDocumentResponse(List<QuestionAnswer> answers) {
}
