package com.jz.crm.domain.dto;

public record SendResult(boolean success, String messageSid, String status, String error) {

    public static SendResult sent(String messageSid, String status) {
        return new SendResult(true, messageSid, status, null);
    }

    public static SendResult failed(String error) {
        return new SendResult(false, null, null, error);
    }
}
