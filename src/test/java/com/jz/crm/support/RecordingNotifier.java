package com.jz.crm.support;

import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.Message;
import com.jz.crm.notify.OperatorNotifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotifier implements OperatorNotifier {

    public record MessageEvent(Long conversationId, String sector, Message message) {}

    public final List<MessageEvent> messages = new CopyOnWriteArrayList<>();
    public final List<Map<String, Long>> queueUpdates = new CopyOnWriteArrayList<>();
    public final List<String> newConversationSectors = new CopyOnWriteArrayList<>();

    @Override
    public void notifyMessage(Long conversationId, String sector, Message message) {
        messages.add(new MessageEvent(conversationId, sector, message));
    }

    @Override
    public void notifyQueueSizes(Map<String, Long> sizesBySector) {
        queueUpdates.add(sizesBySector);
    }

    @Override
    public void notifyNewConversation(String sector, Conversation conversation) {
        newConversationSectors.add(sector);
    }
}
