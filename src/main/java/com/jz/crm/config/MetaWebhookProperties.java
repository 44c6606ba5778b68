package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "crm.meta")
public class MetaWebhookProperties {
    private String verifyToken = "token-verificacao-webhook";
}
