package com.jz.crm.service;

import com.jz.crm.channel.MessageSender;
import com.jz.crm.chat.queue.SectorQueueRouter;
import com.jz.crm.chat.state.ConversationStateMachine;
import com.jz.crm.chat.state.ConversationStateMachine.Transition;
import com.jz.crm.common.ConversationNotFoundException;
import com.jz.crm.common.MessageDeliveryException;
import com.jz.crm.config.RoutingProperties;
import com.jz.crm.domain.dto.SendResult;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.Customer;
import com.jz.crm.domain.entity.Message;
import com.jz.crm.domain.entity.MessageKind;
import com.jz.crm.domain.entity.SenderRole;
import com.jz.crm.memory.ContextStore;
import com.jz.crm.memory.ContextTurn;
import com.jz.crm.notify.OperatorNotifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;

/** What an operator can do from the desk. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperatorDeskService {

    private final ConversationStateMachine stateMachine;
    private final ConversationService conversationService;
    private final CustomerService customerService;
    private final MessageService messageService;
    private final SectorQueueRouter router;
    private final MessageSender sender;
    private final ContextStore contextStore;
    private final OperatorNotifier notifier;
    private final RoutingProperties routing;

    public Conversation accept(Long conversationId, Long operatorId) {
        return afterTransition(stateMachine.accept(conversationId, operatorId));
    }

    public Conversation resolve(Long conversationId) {
        return afterTransition(stateMachine.resolve(conversationId));
    }

    public Conversation close(Long conversationId) {
        return afterTransition(stateMachine.close(conversationId));
    }

    /**
     * Sends first and persists only on success, so the transcript never shows a
     * message the customer didn't get.
     *
     * @throws MessageDeliveryException when the channel refuses the message
     */
    public Message reply(Long conversationId, Long operatorId, String text) {
        if (!StringUtils.hasText(text)) {
            throw new IllegalArgumentException("reply text is empty");
        }
        Conversation c = conversationService.findById(conversationId);
        if (c == null) throw new ConversationNotFoundException(conversationId);
        Customer customer = customerService.findById(c.getCustomerId());
        if (customer == null) throw new ConversationNotFoundException(conversationId);

        SendResult r = sender.send(customer.getAddress(), text);
        if (r == null || !r.success()) {
            String err = r == null ? "no result" : r.error();
            log.error("[Desk] reply not delivered, conv={}, operator={}, err={}", conversationId, operatorId, err);
            throw new MessageDeliveryException("reply not delivered: " + err);
        }

        Message m = Message.builder()
                .conversationId(conversationId)
                .senderRole(SenderRole.OPERATOR)
                .senderId(String.valueOf(operatorId))
                .content(text)
                .kind(MessageKind.TEXT)
                .channelMessageId(r.messageSid())
                .build();
        messageService.create(m);
        contextStore.append(customer.getAddress(), ContextTurn.ASSISTANT, text);
        notifier.notifyMessage(conversationId, sectorOf(c), m);
        log.info("[Desk] reply sent, conv={}, operator={}, sid={}", conversationId, operatorId, r.messageSid());
        return m;
    }

    public Map<String, Long> queueSizes() {
        return router.sizes();
    }

    private Conversation afterTransition(Transition t) {
        if (t.queueReleased()) {
            notifier.notifyQueueSizes(router.sizes());
        }
        return t.conversation();
    }

    private String sectorOf(Conversation c) {
        return StringUtils.hasText(c.getSector()) ? c.getSector() : routing.getNotifyFallbackSector();
    }
}
