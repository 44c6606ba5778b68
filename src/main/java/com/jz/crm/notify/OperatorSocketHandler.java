package com.jz.crm.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ws://host/ws/{operatorId}/{sector}
 * <p>
 * Client frames: {@code {"type":"ping"}} and {@code {"type":"typing","conversation_id":1}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatorSocketHandler extends TextWebSocketHandler {

    private static final String ATTR_OPERATOR = "operatorId";
    private static final String ATTR_SECTOR = "sector";
    private static final String ATTR_CHANNEL = "channel";

    private final OperatorConnectionRegistry registry;
    private final ObjectMapper mapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String[] parts = pathParts(session.getUri());
        if (parts == null) {
            session.close(CloseStatus.BAD_DATA.withReason("expected /ws/{operatorId}/{sector}"));
            return;
        }
        Long operatorId = Long.valueOf(parts[0]);
        String sector = parts[1];
        session.getAttributes().put(ATTR_OPERATOR, operatorId);
        session.getAttributes().put(ATTR_SECTOR, sector);
        OperatorChannel channel = new SessionChannel(session);
        session.getAttributes().put(ATTR_CHANNEL, channel);
        registry.register(operatorId, sector, channel);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        Long operatorId = (Long) session.getAttributes().get(ATTR_OPERATOR);
        String sector = (String) session.getAttributes().get(ATTR_SECTOR);
        JsonNode data = mapper.readTree(message.getPayload());
        String type = data.path("type").asText("");
        switch (type) {
            case "ping" -> session.sendMessage(new TextMessage("{\"type\":\"pong\"}"));
            case "typing" -> {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("type", "agent_typing");
                payload.put("agent_id", operatorId);
                payload.put("conversation_id", data.path("conversation_id").isMissingNode() ? null : data.path("conversation_id").asLong());
                registry.broadcastToSector(sector, mapper.writeValueAsString(payload));
            }
            default -> log.warn("[WS] unknown frame type={} from operator={}", type, operatorId);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Long operatorId = (Long) session.getAttributes().get(ATTR_OPERATOR);
        String sector = (String) session.getAttributes().get(ATTR_SECTOR);
        OperatorChannel channel = (OperatorChannel) session.getAttributes().get(ATTR_CHANNEL);
        if (operatorId != null && channel != null) {
            registry.unregister(operatorId, sector, channel);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("[WS] transport error, operator={}: {}", session.getAttributes().get(ATTR_OPERATOR), exception.getMessage());
    }

    /** {operatorId, sector}, or {@code null} when the path doesn't fit. */
    static String[] pathParts(URI uri) {
        if (uri == null) return null;
        String[] seg = uri.getPath().split("/");
        // "", "ws", "{operatorId}", "{sector}"
        if (seg.length < 4) return null;
        String id = seg[seg.length - 2];
        String sector = seg[seg.length - 1];
        if (!id.chars().allMatch(Character::isDigit) || id.isEmpty() || sector.isBlank()) return null;
        return new String[]{id, sector};
    }

    private static final class SessionChannel implements OperatorChannel {
        private final WebSocketSession session;

        private SessionChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String payload) throws IOException {
            // WebSocketSession is not safe for concurrent sends
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
