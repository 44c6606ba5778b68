package com.jz.crm.chat.state;

import com.jz.crm.chat.queue.SectorQueueRouter;
import com.jz.crm.common.ConversationNotFoundException;
import com.jz.crm.common.IllegalTransitionException;
import com.jz.crm.config.RoutingProperties;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.ConversationStatus;
import com.jz.crm.domain.entity.Customer;
import com.jz.crm.service.ConversationService;
import com.jz.crm.service.CustomerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Owns every status change of a conversation except the bot-to-queue handoff,
 * which belongs to {@link SectorQueueRouter}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationStateMachine {

    private final ConversationService conversationService;
    private final CustomerService customerService;
    private final SectorQueueRouter router;
    private final RoutingProperties routing;
    private final Clock clock;

    /**
     * @param queueReleased whether the conversation gave up a slot in a sector queue
     */
    public record Transition(Conversation conversation, ConversationStatus from, boolean queueReleased) {}

    /**
     * The conversation a new inbound message belongs to. In order:
     * the latest active one; the latest one if it was resolved recently (reopened);
     * otherwise a fresh conversation.
     */
    public Conversation resolveActive(Customer customer) {
        Conversation active = conversationService.findLatestActive(customer.getId());
        if (active != null) {
            return active;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Conversation latest = conversationService.findLatest(customer.getId());
        if (latest != null && latest.getStatus() == ConversationStatus.RESOLVED) {
            LocalDateTime reference = latest.getResolvedAt() != null ? latest.getResolvedAt() : latest.getStartedAt();
            if (reference != null && !reference.isBefore(now.minus(routing.getReactivationWindow()))) {
                latest.setStatus(ConversationStatus.BOT_HANDLING);
                latest.setResolvedAt(null);
                latest.setOperatorId(null);
                latest.setSector(null);
                latest.setIntent(null);
                conversationService.modify(latest);
                log.info("[State] reactivated, conv={}, customer={}", latest.getId(), customer.getId());
                return latest;
            }
        }

        Conversation fresh = Conversation.builder()
                .customerId(customer.getId())
                .status(ConversationStatus.BOT_HANDLING)
                .startedAt(now)
                .build();
        conversationService.create(fresh);

        int total = customer.getTotalConversations() == null ? 0 : customer.getTotalConversations();
        customer.setTotalConversations(total + 1);
        customerService.modify(customer);
        log.info("[State] new conversation, conv={}, customer={}", fresh.getId(), customer.getId());
        return fresh;
    }

    /** Operator takes the conversation, from the bot or from a queue. */
    public Transition accept(Long conversationId, Long operatorId) {
        Conversation c = load(conversationId);
        ConversationStatus from = check(c, ConversationStatus.IN_PROGRESS);
        boolean released = from == ConversationStatus.WAITING_QUEUE && releaseSlot(c);
        c.setStatus(ConversationStatus.IN_PROGRESS);
        c.setOperatorId(operatorId);
        conversationService.modify(c);
        log.info("[State] accepted, conv={}, operator={}, from={}", conversationId, operatorId, from.getCode());
        return new Transition(c, from, released);
    }

    public Transition resolve(Long conversationId) {
        Conversation c = load(conversationId);
        ConversationStatus from = check(c, ConversationStatus.RESOLVED);
        boolean released = from == ConversationStatus.WAITING_QUEUE && releaseSlot(c);
        c.setStatus(ConversationStatus.RESOLVED);
        c.setResolvedAt(LocalDateTime.now(clock));
        conversationService.modify(c);
        log.info("[State] resolved, conv={}, from={}", conversationId, from.getCode());
        return new Transition(c, from, released);
    }

    public Transition close(Long conversationId) {
        Conversation c = load(conversationId);
        ConversationStatus from = check(c, ConversationStatus.CLOSED);
        c.setStatus(ConversationStatus.CLOSED);
        if (c.getResolvedAt() == null) {
            c.setResolvedAt(LocalDateTime.now(clock));
        }
        conversationService.modify(c);
        log.info("[State] closed, conv={}, from={}", conversationId, from.getCode());
        return new Transition(c, from, false);
    }

    private Conversation load(Long id) {
        Conversation c = conversationService.findById(id);
        if (c == null) throw new ConversationNotFoundException(id);
        return c;
    }

    private ConversationStatus check(Conversation c, ConversationStatus to) {
        ConversationStatus from = c.getStatus();
        if (!from.canTransitionTo(to)) {
            throw new IllegalTransitionException(c.getId(), from, to);
        }
        return from;
    }

    // the status change still goes through when the queue can't be reached
    private boolean releaseSlot(Conversation c) {
        try {
            return router.removeEverywhere(c.getId()) > 0;
        } catch (Exception e) {
            log.error("[State] queue release failed, conv={}, sector={}, err={}", c.getId(), c.getSector(), e.getMessage());
            return false;
        }
    }
}
