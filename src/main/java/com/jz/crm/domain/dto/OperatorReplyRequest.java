package com.jz.crm.domain.dto;

import lombok.Data;

@Data
public class OperatorReplyRequest {
    private Long operatorId;
    private String text;
}
