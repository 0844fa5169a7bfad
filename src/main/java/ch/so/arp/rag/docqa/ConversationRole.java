package ch.so.arp.rag.docqa;

/**
 * Author of a {@link ConversationTurn}.
 */
public enum ConversationRole {

    USER("user"),
    ASSISTANT("assistant");

    private final String apiName;

    ConversationRole(String apiName) {
        this.apiName = apiName;
    }

    /**
     * @return the role name used in chat completion messages
     */
    public String apiName() {
        return apiName;
    }
}
