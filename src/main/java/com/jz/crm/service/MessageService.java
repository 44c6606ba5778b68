package com.jz.crm.service;

import com.jz.crm.domain.entity.Message;

public interface MessageService {
    void create(Message message);
    /** Writes the intent tag only; message content is immutable. */
    void tagIntent(Long messageId, String intent);
}
