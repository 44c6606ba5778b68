package com.jz.crm.domain.entity;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Conversation lifecycle.
 * <pre>
 * bot_handling -> waiting_queue -> in_progress -> resolved -> closed
 * </pre>
 * {@code resolved -> bot_handling} is the reactivation edge taken when the customer
 * writes again shortly after resolution.
 */
public enum ConversationStatus {
    BOT_HANDLING("bot_handling"),
    WAITING_QUEUE("waiting_queue"),
    IN_PROGRESS("in_progress"),
    RESOLVED("resolved"),
    CLOSED("closed");

    @EnumValue
    @JsonValue
    private final String code;

    ConversationStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Non-resolved, non-closed. */
    public boolean isActive() {
        return this != RESOLVED && this != CLOSED;
    }

    public boolean canTransitionTo(ConversationStatus target) {
        return switch (target) {
            case BOT_HANDLING -> this == RESOLVED;
            case WAITING_QUEUE -> this == BOT_HANDLING;
            case IN_PROGRESS -> this == BOT_HANDLING || this == WAITING_QUEUE;
            case RESOLVED -> isActive();
            case CLOSED -> this == RESOLVED || this == IN_PROGRESS;
        };
    }

    public static ConversationStatus fromCode(String code) {
        for (ConversationStatus s : values()) {
            if (s.code.equalsIgnoreCase(code)) return s;
        }
        throw new IllegalArgumentException("unknown conversation status: " + code);
    }
}
