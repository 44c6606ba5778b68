package com.jz.crm.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.time.ZoneId;

@Data
@ConfigurationProperties(prefix = "crm.business-hours")
public class BusinessHoursProperties {
    private ZoneId zone = ZoneId.of("America/Sao_Paulo");
    private LocalTime start = LocalTime.of(8, 0);
    private LocalTime weekdayEnd = LocalTime.of(18, 0);
    private boolean saturdayOpen = true;
    private LocalTime saturdayEnd = LocalTime.of(12, 0);
    private boolean sundayOpen = false;
}
