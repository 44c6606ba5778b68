package com.jz.crm.domain.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("conversation")
public class Conversation {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long customerId;

    // reactivation writes nulls back, so these must not be skipped on update
    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private Long operatorId;

    private ConversationStatus status;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private String sector;
    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private String intent;

    @Builder.Default
    private Integer priority = 0;

    private LocalDateTime startedAt;
    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private LocalDateTime resolvedAt;
}
