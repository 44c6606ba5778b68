package com.jz.crm.chat.async;

import com.jz.crm.config.DebounceProperties;
import com.jz.crm.store.KvBackend;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-address "latest message wins" marker used to coalesce bursts.
 * <ul>
 *   <li>{@link #arm} stores the current instant as the address's latest marker;</li>
 *   <li>the caller waits {@link #delay()} without holding a worker;</li>
 *   <li>{@link #supersededSince} tells the caller whether a later arm happened meanwhile.</li>
 * </ul>
 * Two arms landing within the same read/write window can both see themselves as
 * latest. That is accepted: the gate trims duplicate work, it is not a lock.
 */
@Slf4j
@Component
public class DebounceGate {

    private final KvBackend backend;
    private final DebounceProperties props;
    private final Clock clock;
    private final Counter supersededCounter;

    public DebounceGate(KvBackend backend, DebounceProperties props, Clock clock, MeterRegistry registry) {
        this.backend = backend;
        this.props = props;
        this.clock = clock;
        this.supersededCounter = Counter.builder("crm.debounce.superseded")
                .description("Runs that woke up to find a newer message for the same customer")
                .register(registry);
    }

    private String k(String address) { return props.getKeyPrefix() + address; }

    /** @return the marker this run was armed with; pass it back to {@link #supersededSince}. */
    public long arm(String address) {
        long marker = toMarker(clock.instant());
        try {
            backend.set(k(address), String.valueOf(marker), props.getMarkerTtl());
        } catch (Exception e) {
            log.warn("[Debounce] arm failed, address={}, err={}", address, e.getMessage());
        }
        return marker;
    }

    /** {@code true} only when a strictly newer marker is stored for the address. */
    public boolean supersededSince(String address, long armedAt) {
        String raw;
        try {
            raw = backend.get(k(address));
        } catch (Exception e) {
            log.warn("[Debounce] read failed, address={}, err={}", address, e.getMessage());
            return false;
        }
        if (raw == null) return false;
        long latest;
        try {
            latest = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return false;
        }
        boolean superseded = latest > armedAt;
        if (superseded) supersededCounter.increment();
        return superseded;
    }

    public Duration delay() {
        return props.getDelay();
    }

    // epoch nanos; fits in a long until 2262
    private static long toMarker(Instant t) {
        return t.getEpochSecond() * 1_000_000_000L + t.getNano();
    }
}
