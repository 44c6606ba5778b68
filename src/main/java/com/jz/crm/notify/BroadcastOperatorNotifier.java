package com.jz.crm.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.Message;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON events over {@link OperatorConnectionRegistry}:
 * <ul>
 *   <li>{@code new_message} to every operator, so a desk never misses a reply in a sector it isn't watching;</li>
 *   <li>{@code new_conversation} to the sector only;</li>
 *   <li>{@code queue_update} to every operator.</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastOperatorNotifier implements OperatorNotifier {

    private final OperatorConnectionRegistry registry;
    private final ObjectMapper mapper;

    @Override
    public void notifyMessage(Long conversationId, String sector, Message message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "new_message");
        payload.put("conversation_id", conversationId);
        payload.put("sector", sector);
        payload.put("message", messageView(message));
        int n = push(payload, null);
        log.debug("[Notify] new_message conv={} reached={}", conversationId, n);
    }

    @Override
    public void notifyQueueSizes(Map<String, Long> sizesBySector) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "queue_update");
        payload.put("queue_sizes", sizesBySector);
        push(payload, null);
    }

    @Override
    public void notifyNewConversation(String sector, Conversation conversation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "new_conversation");
        payload.put("conversation", conversationView(conversation));
        push(payload, sector);
    }

    /** @param sector {@code null} for everyone */
    private int push(Map<String, Object> payload, String sector) {
        try {
            String json = mapper.writeValueAsString(payload);
            return sector == null ? registry.broadcastAll(json) : registry.broadcastToSector(sector, json);
        } catch (Exception e) {
            log.error("[Notify] {} failed: {}", payload.get("type"), e.getMessage());
            return 0;
        }
    }

    static Map<String, Object> messageView(Message m) {
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("id", m.getId());
        v.put("conversation_id", m.getConversationId());
        v.put("sender_type", m.getSenderRole() == null ? null : m.getSenderRole().getCode());
        v.put("sender_id", m.getSenderId());
        v.put("content", m.getContent());
        v.put("message_type", m.getKind() == null ? null : m.getKind().getCode());
        v.put("media_url", m.getMediaUrl());
        v.put("intent", m.getIntent());
        v.put("created_at", m.getCreatedAt() == null ? null : m.getCreatedAt().toString());
        return v;
    }

    static Map<String, Object> conversationView(Conversation c) {
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("id", c.getId());
        v.put("customer_id", c.getCustomerId());
        v.put("operator_id", c.getOperatorId());
        v.put("status", c.getStatus() == null ? null : c.getStatus().getCode());
        v.put("sector", c.getSector());
        v.put("intent", c.getIntent());
        v.put("priority", c.getPriority());
        v.put("started_at", c.getStartedAt() == null ? null : c.getStartedAt().toString());
        v.put("resolved_at", c.getResolvedAt() == null ? null : c.getResolvedAt().toString());
        return v;
    }
}
