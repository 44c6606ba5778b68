package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "crm.store")
public class StoreProperties {

    public enum Backend { AUTO, REDIS, MEMORY }

    /** AUTO pings Redis at startup and falls back to memory when it is unreachable. */
    private Backend backend = Backend.AUTO;
}
