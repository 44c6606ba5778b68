package com.jz.crm.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.jz.crm.domain.dto.InboundMessage;
import com.jz.crm.domain.entity.MessageKind;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * WhatsApp Cloud API webhook body -> inbound messages.
 * <pre>
 * { "object": "whatsapp_business_account",
 *   "entry": [ { "changes": [ { "field": "messages",
 *       "value": { "contacts": [ { "profile": { "name": ".." } } ],
 *                  "messages": [ { "from": "..", "id": "wamid..", "type": "text", "text": { "body": ".." } } ] } } ] } ] }
 * </pre>
 */
@Component
public class MetaWebhookParser {

    static final String OBJECT = "whatsapp_business_account";

    public List<InboundMessage> parse(JsonNode body) {
        List<InboundMessage> out = new ArrayList<>();
        if (body == null || !OBJECT.equals(body.path("object").asText())) {
            return out;
        }
        for (JsonNode entry : body.path("entry")) {
            for (JsonNode change : entry.path("changes")) {
                if (!"messages".equals(change.path("field").asText())) continue;

                JsonNode value = change.path("value");
                JsonNode contacts = value.path("contacts");
                String contactName = contacts.isArray() && contacts.size() > 0
                        ? textOrNull(contacts.get(0).path("profile").path("name"))
                        : null;

                for (JsonNode msg : value.path("messages")) {
                    String type = msg.path("type").asText("text");
                    String content = contentOf(msg, type);
                    String from = textOrNull(msg.path("from"));
                    if (!StringUtils.hasText(content) || !StringUtils.hasText(from)) continue;

                    out.add(InboundMessage.builder()
                            .from(from)
                            .text(content)
                            .channelMessageId(textOrNull(msg.path("id")))
                            .senderName(contactName)
                            .kind(MessageKind.fromChannelType(type))
                            .build());
                }
            }
        }
        return out;
    }

    static String contentOf(JsonNode msg, String type) {
        switch (type) {
            case "text":
                return msg.path("text").path("body").asText("");
            case "image":
                String caption = textOrNull(msg.path("image").path("caption"));
                return caption != null ? caption : "[Imagem]";
            case "audio":
                return "[Áudio]";
            default:
                return "[" + type + "]";
        }
    }

    private static String textOrNull(JsonNode n) {
        return n == null || n.isMissingNode() || n.isNull() ? null : n.asText();
    }
}
