package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "crm.context")
public class ContextProperties {
    private String keyPrefix = "context:";
    /** Turns kept per customer, oldest evicted first. */
    private int maxMessages = 10;
    /** Sliding expiry, reset on every write. */
    private Duration ttl = Duration.ofHours(24);
}
