package com.jz.crm.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.crm.chat.queue.SectorQueueRouter;
import com.jz.crm.chat.state.ConversationStateMachine;
import com.jz.crm.common.ConversationNotFoundException;
import com.jz.crm.common.IllegalTransitionException;
import com.jz.crm.common.MessageDeliveryException;
import com.jz.crm.config.ContextProperties;
import com.jz.crm.config.RoutingProperties;
import com.jz.crm.domain.dto.SendResult;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.ConversationStatus;
import com.jz.crm.domain.entity.Customer;
import com.jz.crm.domain.entity.Message;
import com.jz.crm.domain.entity.SenderRole;
import com.jz.crm.memory.ContextStore;
import com.jz.crm.memory.ContextTurn;
import com.jz.crm.store.InMemoryKvBackend;
import com.jz.crm.support.FakeConversationService;
import com.jz.crm.support.FakeCustomerService;
import com.jz.crm.support.FakeMessageService;
import com.jz.crm.support.MutableClock;
import com.jz.crm.support.RecordingNotifier;
import com.jz.crm.support.RecordingSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class OperatorDeskServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-10T12:00:00Z"));
    private final InMemoryKvBackend kv = new InMemoryKvBackend(clock);
    private final FakeConversationService conversations = new FakeConversationService();
    private final FakeCustomerService customers = new FakeCustomerService();
    private final FakeMessageService messages = new FakeMessageService();
    private final RecordingSender sender = new RecordingSender();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final RoutingProperties routing = new RoutingProperties();
    private final SectorQueueRouter router = new SectorQueueRouter(kv, routing);
    private final ContextStore context = new ContextStore(kv, new ObjectMapper(), new ContextProperties());

    private final OperatorDeskService desk = new OperatorDeskService(
            new ConversationStateMachine(conversations, customers, router, routing, clock),
            conversations, customers, messages, router, sender, context, notifier, routing);

    private Conversation conversation;

    @BeforeEach
    void setUp() {
        Customer customer = Customer.builder().address("5553999990000").build();
        customers.create(customer);
        conversation = Conversation.builder()
                .customerId(customer.getId())
                .status(ConversationStatus.BOT_HANDLING)
                .startedAt(LocalDateTime.of(2025, 3, 10, 11, 0))
                .build();
        conversations.create(conversation);
    }

    @Test
    void acceptingAQueuedConversationPublishesQueueSizes() {
        router.handoff(conversation, "contas_receber");

        Conversation c = desk.accept(conversation.getId(), 7L);

        assertEquals(ConversationStatus.IN_PROGRESS, c.getStatus());
        assertEquals(7L, c.getOperatorId());
        assertEquals(1, notifier.queueUpdates.size());
        assertEquals(0L, notifier.queueUpdates.get(0).get("contas_receber"));
    }

    @Test
    void resolvingABotConversationPublishesNothing() {
        desk.resolve(conversation.getId());
        assertEquals(ConversationStatus.RESOLVED, conversation.getStatus());
        assertTrue(notifier.queueUpdates.isEmpty());
    }

    @Test
    void closeAfterResolve() {
        desk.resolve(conversation.getId());
        assertEquals(ConversationStatus.CLOSED, desk.close(conversation.getId()).getStatus());
        assertThrows(IllegalTransitionException.class, () -> desk.close(conversation.getId()));
    }

    @Test
    void replyIsSentRecordedAndRemembered() {
        desk.accept(conversation.getId(), 7L);

        Message m = desk.reply(conversation.getId(), 7L, "Oi, sou a Bia do financeiro.");

        assertEquals(SenderRole.OPERATOR, m.getSenderRole());
        assertEquals("7", m.getSenderId());
        assertEquals("SM123", m.getChannelMessageId());
        assertEquals(1, sender.sent.size());
        assertEquals("5553999990000", sender.sent.get(0).to());
        ContextTurn last = context.read("5553999990000").get(0);
        assertEquals(ContextTurn.ASSISTANT, last.getRole());
        assertEquals(1, notifier.messages.size());
        assertEquals("comercial", notifier.messages.get(0).sector());
    }

    @Test
    void undeliveredReplyIsNotRecorded() {
        sender.next = SendResult.failed("Twilio not configured");

        assertThrows(MessageDeliveryException.class, () -> desk.reply(conversation.getId(), 7L, "oi"));
        assertTrue(messages.rows.isEmpty());
        assertTrue(context.read("5553999990000").isEmpty());
    }

    @Test
    void unknownConversation() {
        assertThrows(ConversationNotFoundException.class, () -> desk.reply(404L, 7L, "oi"));
        assertThrows(ConversationNotFoundException.class, () -> desk.accept(404L, 7L));
    }

    @Test
    void queueSizesListEverySector() {
        assertEquals(routing.getSectors().size(), desk.queueSizes().size());
    }
}
