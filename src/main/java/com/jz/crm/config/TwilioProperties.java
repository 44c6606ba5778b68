package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@Data
@ConfigurationProperties(prefix = "crm.twilio")
public class TwilioProperties {
    private String apiBase = "https://api.twilio.com/2010-04-01";
    private String accountSid = "";
    private String authToken = "";
    private String whatsappNumber = "+14155238886";   // sandbox number

    public boolean isConfigured() {
        return StringUtils.hasText(accountSid) && StringUtils.hasText(authToken);
    }
}
