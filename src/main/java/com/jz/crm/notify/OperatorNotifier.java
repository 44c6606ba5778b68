package com.jz.crm.notify;

import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.Message;

import java.util.Map;

/** Fire-and-forget pushes to connected operator desks. Failures are logged, never thrown. */
public interface OperatorNotifier {

    void notifyMessage(Long conversationId, String sector, Message message);

    void notifyQueueSizes(Map<String, Long> sizesBySector);

    void notifyNewConversation(String sector, Conversation conversation);
}
