package com.jz.crm.chat.state;

import com.jz.crm.config.BusinessHoursProperties;
import com.jz.crm.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class BusinessHoursEvaluatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-10T12:00:00Z"));
    private final BusinessHoursEvaluator hours = new BusinessHoursEvaluator(new BusinessHoursProperties(), clock);

    // 2025-03-10 is a Monday
    @ParameterizedTest
    @CsvSource({
            "2025-03-10T07:59, false",
            "2025-03-10T08:00, true",
            "2025-03-12T12:30, true",
            "2025-03-14T18:00, true",
            "2025-03-14T18:01, false",
            "2025-03-15T07:59, false",
            "2025-03-15T08:00, true",
            "2025-03-15T12:00, true",
            "2025-03-15T12:01, false",
            "2025-03-16T10:00, false"
    })
    void schedule(String at, boolean open) {
        assertEquals(open, hours.isOpen(LocalDateTime.parse(at)));
    }

    @Test
    void sundayCanBeOpenedByConfig() {
        BusinessHoursProperties props = new BusinessHoursProperties();
        props.setSundayOpen(true);
        assertTrue(new BusinessHoursEvaluator(props, clock).isOpen(LocalDateTime.parse("2025-03-16T03:00")));
    }

    @Test
    void nowIsEvaluatedInTheConfiguredZone() {
        // 12:00 UTC is 09:00 in Sao Paulo
        assertTrue(hours.isOpenNow());
        // 22:00 UTC is 19:00 in Sao Paulo
        clock.set(Instant.parse("2025-03-10T22:00:00Z"));
        assertFalse(hours.isOpenNow());
        // 10:30 UTC is 07:30 in Sao Paulo
        clock.set(Instant.parse("2025-03-10T10:30:00Z"));
        assertFalse(hours.isOpenNow());
    }
}
