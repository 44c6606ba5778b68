package com.jz.crm.common;

public class ConversationNotFoundException extends RuntimeException {

    private final Long conversationId;

    public ConversationNotFoundException(Long conversationId) {
        super("conversation " + conversationId + " not found");
        this.conversationId = conversationId;
    }

    public Long getConversationId() {
        return conversationId;
    }
}
