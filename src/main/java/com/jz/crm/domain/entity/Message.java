package com.jz.crm.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("message")
public class Message {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long conversationId;

    private SenderRole senderRole;
    private String senderId;                 // customer address, operator id or "bot"

    private String content;

    @Builder.Default
    private MessageKind kind = MessageKind.TEXT;
    private String mediaUrl;
    private String channelMessageId;         // Twilio MessageSid / Meta wamid

    private String intent;

    @TableField("is_read")
    @Builder.Default
    private Boolean read = false;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;
}
