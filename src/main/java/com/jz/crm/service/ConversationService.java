package com.jz.crm.service;

import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.ConversationStatus;

public interface ConversationService {
    Conversation findById(Long id);

    /** Latest conversation that is neither resolved nor closed, or {@code null}. */
    Conversation findLatestActive(Long customerId);

    /** Latest conversation in any status, or {@code null}. */
    Conversation findLatest(Long customerId);

    void create(Conversation conversation);
    void modify(Conversation conversation);

    /**
     * Writes only status, sector and intent, and only while the stored status is still
     * {@code expected}. Operator and resolution fields are left alone.
     *
     * @return {@code false} when the row moved on in the meantime and nothing was written
     */
    boolean applyRouting(Conversation conversation, ConversationStatus expected);
}
