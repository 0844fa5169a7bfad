package ch.so.arp.rag.docqa;

public record QuestionAnswer(String question, String answer) {
}
