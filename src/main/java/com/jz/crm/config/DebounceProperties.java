package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "crm.debounce")
public class DebounceProperties {
    private String keyPrefix = "debounce:";
    /** How long a run waits for follow-up messages before it classifies. */
    private Duration delay = Duration.ofMillis(2000);
    /** Lifetime of the latest-seen marker; only needs to outlive the delay. */
    private Duration markerTtl = Duration.ofSeconds(60);
}
