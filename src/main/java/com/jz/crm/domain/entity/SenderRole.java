package com.jz.crm.domain.entity;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SenderRole {
    CUSTOMER("customer"),
    BOT("bot"),
    OPERATOR("operator");

    @EnumValue
    @JsonValue
    private final String code;

    SenderRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
