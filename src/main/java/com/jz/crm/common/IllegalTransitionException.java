package com.jz.crm.common;

import com.jz.crm.domain.entity.ConversationStatus;

/** Raised when a lifecycle action does not apply to the conversation's current status. */
public class IllegalTransitionException extends RuntimeException {

    private final ConversationStatus from;
    private final ConversationStatus to;

    public IllegalTransitionException(Long conversationId, ConversationStatus from, ConversationStatus to) {
        super("conversation " + conversationId + " cannot move from " + from.getCode() + " to " + to.getCode());
        this.from = from;
        this.to = to;
    }

    public ConversationStatus getFrom() {
        return from;
    }

    public ConversationStatus getTo() {
        return to;
    }
}
