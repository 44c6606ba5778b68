package com.jz.crm.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.crm.memory.ContextTurn;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatClientIntentClassifierTest {

    /** Answers every prompt with a fixed text and remembers the last prompt. */
    static class StubChatModel implements ChatModel {
        String reply = "{}";
        RuntimeException fail;
        Prompt last;

        @Override
        public ChatResponse call(Prompt prompt) {
            last = prompt;
            if (fail != null) throw fail;
            return new ChatResponse(List.of(new Generation(new AssistantMessage(reply))));
        }
    }

    private final StubChatModel model = new StubChatModel();
    private final ChatClientIntentClassifier classifier =
            new ChatClientIntentClassifier(ChatClient.builder(model).build(), new ObjectMapper());

    @Test
    void parsesCompleteReply() {
        ClassifierVerdict v = classifier.parse("""
                {"intent":"atendente","needs_human":true,"response":"Vou te encaminhar.","confidence":0.92}
                """);
        assertEquals("atendente", v.getIntent());
        assertTrue(v.isNeedsHuman());
        assertEquals("Vou te encaminhar.", v.getResponse());
        assertEquals(0.92, v.getConfidence(), 1e-9);
    }

    @Test
    void fillsDefaultsForMissingFields() {
        ClassifierVerdict v = classifier.parse("{\"response\":\"Oi!\"}");
        assertEquals("outros", v.getIntent());
        assertFalse(v.isNeedsHuman());
        assertEquals(0.5, v.getConfidence(), 1e-9);
    }

    @Test
    void missingResponseForcesHuman() {
        ClassifierVerdict v = classifier.parse("{\"intent\":\"geral\",\"needs_human\":false}");
        assertTrue(v.isNeedsHuman());
        assertEquals(ChatClientIntentClassifier.FALLBACK_MISSING, v.getResponse());
        assertEquals("geral", v.getIntent());
    }

    @Test
    void extractsJsonWrappedInProse() {
        ClassifierVerdict v = classifier.parse("Claro! ```json\n{\"intent\":\"rh\",\"needs_human\":true,\"response\":\"ok\"}\n```");
        assertEquals("rh", v.getIntent());
    }

    @Test
    void unparseableReplyAsksForHuman() {
        ClassifierVerdict v = classifier.parse("não sei");
        assertEquals("outros", v.getIntent());
        assertTrue(v.isNeedsHuman());
        assertEquals(0.0, v.getConfidence(), 1e-9);
        assertEquals(ChatClientIntentClassifier.FALLBACK_UNPARSEABLE, v.getResponse());

        assertEquals(ChatClientIntentClassifier.FALLBACK_UNPARSEABLE, classifier.parse("{broken").getResponse());
    }

    @Test
    void promptCarriesNameAndOutOfHoursNote() {
        assertEquals("Mensagem do cliente: oi", ChatClientIntentClassifier.userPrompt("oi", null, true));
        assertEquals("Cliente: Ana\nMensagem do cliente: oi", ChatClientIntentClassifier.userPrompt("oi", "Ana", true));
        assertTrue(ChatClientIntentClassifier.userPrompt("oi", "Ana", false)
                .endsWith(ChatClientIntentClassifier.OUT_OF_HOURS_NOTE));
    }

    @Test
    void historyKeepsRolesInOrder() {
        List<Message> history = ChatClientIntentClassifier.toHistory(List.of(
                ContextTurn.user("oi"), ContextTurn.assistant("olá"), ContextTurn.user("preço?")));
        assertEquals(3, history.size());
        assertEquals(MessageType.USER, history.get(0).getMessageType());
        assertEquals(MessageType.ASSISTANT, history.get(1).getMessageType());
        assertEquals("preço?", history.get(2).getText());
    }

    @Test
    void classifySendsHistoryThenCurrentMessage() {
        model.reply = "{\"intent\":\"geral\",\"needs_human\":false,\"response\":\"Abrimos às 7h.\",\"confidence\":0.8}";

        ClassifierVerdict v = classifier.classify("que horas abre?", List.of(ContextTurn.user("oi"), ContextTurn.assistant("olá")), "Ana", true);

        assertEquals("Abrimos às 7h.", v.getResponse());
        List<Message> sent = model.last.getInstructions();
        Message current = sent.get(sent.size() - 1);
        assertEquals(MessageType.USER, current.getMessageType());
        assertEquals("Cliente: Ana\nMensagem do cliente: que horas abre?", current.getText());
        assertTrue(sent.stream().anyMatch(m -> m.getMessageType() == MessageType.SYSTEM));
        assertTrue(sent.stream().anyMatch(m -> m.getMessageType() == MessageType.ASSISTANT && "olá".equals(m.getText())));
    }

    @Test
    void callFailureYieldsTechnicalFallback() {
        model.fail = new IllegalStateException("timeout");
        ClassifierVerdict v = classifier.classify("oi", List.of(), null, true);
        assertEquals("outros", v.getIntent());
        assertTrue(v.isNeedsHuman());
        assertEquals(ChatClientIntentClassifier.FALLBACK_ERROR, v.getResponse());
    }
}
