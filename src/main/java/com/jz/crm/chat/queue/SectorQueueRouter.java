package com.jz.crm.chat.queue;

import com.jz.crm.config.RoutingProperties;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.ConversationStatus;
import com.jz.crm.store.KvBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * FIFO queue of conversation ids per sector, key {queueKeyPrefix}{sector}.
 * <p>
 * {@link #handoff} mutates the conversation in memory only; the caller persists it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectorQueueRouter {

    private final KvBackend backend;
    private final RoutingProperties props;

    private String k(String sector) { return props.getQueueKeyPrefix() + sector; }

    private String checked(String sector) {
        if (!props.isSector(sector)) {
            throw new IllegalArgumentException("unknown sector: " + sector);
        }
        return sector.toLowerCase(Locale.ROOT);
    }

    public void enqueue(String sector, Long conversationId) {
        backend.pushTail(k(checked(sector)), String.valueOf(conversationId));
    }

    /** Oldest waiting conversation of the sector, or {@code null} when empty. */
    public Long dequeueNext(String sector) {
        String head = backend.popHead(k(checked(sector)));
        return head == null ? null : Long.valueOf(head);
    }

    /** @return how many entries were removed */
    public long remove(String sector, Long conversationId) {
        return backend.removeAll(k(checked(sector)), String.valueOf(conversationId));
    }

    /**
     * Drops the id from every sector queue. The conversation's sector field can be
     * re-labelled while it waits, so it doesn't always name the queue holding it.
     *
     * @return how many entries were removed across all sectors
     */
    public long removeEverywhere(Long conversationId) {
        String member = String.valueOf(conversationId);
        long removed = 0;
        for (String sector : props.getSectors()) {
            removed += backend.removeAll(k(sector), member);
        }
        return removed;
    }

    /** Every configured sector, including empty ones. A sector whose size can't be read reports 0. */
    public Map<String, Long> sizes() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (String sector : props.getSectors()) {
            long n = 0;
            try {
                n = backend.length(k(sector));
            } catch (Exception e) {
                log.warn("[Queue] size read failed, sector={}, err={}", sector, e.getMessage());
            }
            out.put(sector, n);
        }
        return out;
    }

    /** Intent table first, then an intent that already names a sector passes through. */
    public Optional<String> resolveSector(String intent) {
        if (!StringUtils.hasText(intent)) return Optional.empty();
        String key = intent.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : props.getIntentSectors().entrySet()) {
            if (e.getKey().equalsIgnoreCase(key)) return Optional.of(e.getValue());
        }
        return props.isSector(key) ? Optional.of(key) : Optional.empty();
    }

    /**
     * Puts a conversation that needs a human into a sector queue.
     *
     * @param resolvedSector may be {@code null}; the default handoff sector is used then
     */
    public HandoffOutcome handoff(Conversation conversation, String resolvedSector) {
        String target = props.isSector(resolvedSector)
                ? resolvedSector.toLowerCase(Locale.ROOT)
                : props.getDefaultHandoffSector();
        ConversationStatus status = conversation.getStatus();

        if (status == ConversationStatus.BOT_HANDLING) {
            enqueue(target, conversation.getId());
            conversation.setSector(target);
            conversation.setStatus(ConversationStatus.WAITING_QUEUE);
            log.info("[Queue] enqueued, conv={}, sector={}", conversation.getId(), target);
            return HandoffOutcome.ENQUEUED;
        }
        if (status == ConversationStatus.WAITING_QUEUE) {
            String current = conversation.getSector();
            if (backend.range(k(target)).contains(String.valueOf(conversation.getId()))) {
                conversation.setSector(target);
                return HandoffOutcome.UNCHANGED;
            }
            removeEverywhere(conversation.getId());
            enqueue(target, conversation.getId());
            conversation.setSector(target);
            log.info("[Queue] migrated, conv={}, {} -> {}", conversation.getId(), current, target);
            return HandoffOutcome.MIGRATED;
        }
        log.warn("[Queue] handoff rejected, conv={}, status={}", conversation.getId(), status.getCode());
        return HandoffOutcome.REJECTED;
    }
}
