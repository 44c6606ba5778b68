package com.jz.crm.domain.entity;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageKind {
    TEXT("text"),
    IMAGE("image"),
    AUDIO("audio"),
    DOCUMENT("document"),
    OTHER("other");

    @EnumValue
    @JsonValue
    private final String code;

    MessageKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Channel type names outside the known set map to {@link #OTHER}. */
    public static MessageKind fromChannelType(String type) {
        if (type == null) return TEXT;
        for (MessageKind k : values()) {
            if (k.code.equalsIgnoreCase(type)) return k;
        }
        return OTHER;
    }
}
