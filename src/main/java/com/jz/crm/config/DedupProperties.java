package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "crm.dedup")
public class DedupProperties {
    private String keyPrefix = "dedup:last_resp:";
    private Duration defaultTtl = Duration.ofSeconds(15);
    private Duration appLinkTtl = Duration.ofSeconds(60);
    /** Any reply containing one of these collapses to {@link #appLinkKey}. */
    private List<String> appLinkMarkers = new ArrayList<>(List.of("play.google.com", "apps.apple.com"));
    private String appLinkKey = "STATIC_KEY:APP_LINKS";
}
