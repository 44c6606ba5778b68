package com.jz.crm.domain.dto;

import com.jz.crm.domain.entity.MessageKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One customer message as delivered by a channel webhook, before any lookup. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    private String from;                 // raw channel address, normalized by the dispatcher
    private String text;
    private String channelMessageId;
    private String senderName;
    @Builder.Default
    private MessageKind kind = MessageKind.TEXT;
    private String mediaUrl;
}
