package ch.so.arp.rag.docqa;

import java.util.Objects;

public record ConversationTurn(ConversationRole role, String content) {

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(ConversationRole.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(ConversationRole.ASSISTANT, content);
    }
}
