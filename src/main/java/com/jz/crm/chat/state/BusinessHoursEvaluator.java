package com.jz.crm.chat.state;

import com.jz.crm.config.BusinessHoursProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

/** Whether a human could answer right now. Both ends of each window are inclusive. */
@Component
@RequiredArgsConstructor
public class BusinessHoursEvaluator {

    private final BusinessHoursProperties props;
    private final Clock clock;

    public boolean isOpenNow() {
        return isOpen(LocalDateTime.now(clock.withZone(props.getZone())));
    }

    public boolean isOpen(LocalDateTime at) {
        DayOfWeek day = at.getDayOfWeek();
        LocalTime t = at.toLocalTime();
        if (day == DayOfWeek.SUNDAY) {
            return props.isSundayOpen();
        }
        if (day == DayOfWeek.SATURDAY) {
            return props.isSaturdayOpen() && within(t, props.getSaturdayEnd());
        }
        return within(t, props.getWeekdayEnd());
    }

    private boolean within(LocalTime t, LocalTime end) {
        return !t.isBefore(props.getStart()) && !t.isAfter(end);
    }
}
