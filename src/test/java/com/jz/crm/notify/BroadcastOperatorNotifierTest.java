package com.jz.crm.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.crm.domain.entity.Conversation;
import com.jz.crm.domain.entity.ConversationStatus;
import com.jz.crm.domain.entity.Message;
import com.jz.crm.domain.entity.SenderRole;
import com.jz.crm.store.InMemoryKvBackend;
import com.jz.crm.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastOperatorNotifierTest {

    static class FakeChannel implements OperatorChannel {
        final List<String> received = new CopyOnWriteArrayList<>();
        boolean open = true;
        boolean broken;

        @Override
        public void send(String payload) throws IOException {
            if (broken) throw new IOException("broken pipe");
            received.add(payload);
        }

        @Override
        public boolean isOpen() {
            return open;
        }
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private final InMemoryKvBackend kv = new InMemoryKvBackend(new MutableClock(Instant.parse("2025-03-10T12:00:00Z")));
    private final OperatorConnectionRegistry registry = new OperatorConnectionRegistry(kv);
    private final BroadcastOperatorNotifier notifier = new BroadcastOperatorNotifier(registry, mapper);

    private final FakeChannel rh = new FakeChannel();
    private final FakeChannel comercial = new FakeChannel();

    private void connectBoth() {
        registry.register(1L, "rh", rh);
        registry.register(2L, "comercial", comercial);
    }

    @Test
    void messagesReachEveryOperator() throws Exception {
        connectBoth();
        Message m = Message.builder().id(10L).conversationId(5L).senderRole(SenderRole.BOT).senderId("bot").content("Olá").build();

        notifier.notifyMessage(5L, "rh", m);

        assertEquals(1, rh.received.size());
        assertEquals(1, comercial.received.size());
        JsonNode n = mapper.readTree(rh.received.get(0));
        assertEquals("new_message", n.path("type").asText());
        assertEquals(5L, n.path("conversation_id").asLong());
        assertEquals("bot", n.path("message").path("sender_type").asText());
        assertEquals("Olá", n.path("message").path("content").asText());
    }

    @Test
    void newConversationGoesToItsSectorOnly() throws Exception {
        connectBoth();
        Conversation c = Conversation.builder().id(5L).customerId(3L).status(ConversationStatus.WAITING_QUEUE).sector("rh").build();

        notifier.notifyNewConversation("rh", c);

        assertEquals(1, rh.received.size());
        assertTrue(comercial.received.isEmpty());
        JsonNode n = mapper.readTree(rh.received.get(0));
        assertEquals("new_conversation", n.path("type").asText());
        assertEquals("waiting_queue", n.path("conversation").path("status").asText());
    }

    @Test
    void queueUpdateCarriesSizes() throws Exception {
        connectBoth();
        notifier.notifyQueueSizes(Map.of("rh", 2L));
        JsonNode n = mapper.readTree(comercial.received.get(0));
        assertEquals("queue_update", n.path("type").asText());
        assertEquals(2L, n.path("queue_sizes").path("rh").asLong());
    }

    @Test
    void brokenChannelIsDroppedAndOthersStillServed() {
        connectBoth();
        rh.broken = true;

        assertEquals(1, registry.broadcastAll("{}"));
        assertEquals(1, registry.connectedCount());
        assertEquals(Set.of("2"), registry.onlineOperators());
        assertEquals(1, comercial.received.size());
    }

    @Test
    void closedChannelIsDropped() {
        connectBoth();
        comercial.open = false;
        assertFalse(registry.sendTo(2L, "{}"));
        assertEquals(0, registry.broadcastToSector("comercial", "{}"));
    }

    @Test
    void lateCloseOfReplacedConnectionKeepsTheNewOne() {
        FakeChannel old = new FakeChannel();
        FakeChannel fresh = new FakeChannel();
        registry.register(1L, "rh", old);
        registry.register(1L, "rh", fresh);

        registry.unregister(1L, "rh", old);

        assertTrue(registry.sendTo(1L, "{}"));
        assertEquals(1, fresh.received.size());
        assertEquals(Set.of("1"), registry.onlineOperators());
    }

    @Test
    void reconnectToAnotherSectorMovesTheOperator() {
        registry.register(1L, "rh", rh);
        FakeChannel again = new FakeChannel();
        registry.register(1L, "compras", again);

        assertEquals(0, registry.broadcastToSector("rh", "{}"));
        assertEquals(1, registry.broadcastToSector("compras", "{}"));
    }

    @Test
    void socketPathParsing() {
        assertArrayEquals(new String[]{"42", "rh"}, OperatorSocketHandler.pathParts(URI.create("ws://host/ws/42/rh")));
        assertNull(OperatorSocketHandler.pathParts(URI.create("ws://host/ws/abc/rh")));
        assertNull(OperatorSocketHandler.pathParts(URI.create("ws://host/ws/42")));
    }
}
