package com.jz.crm.guard;

import com.jz.crm.config.DedupProperties;
import com.jz.crm.store.InMemoryKvBackend;
import com.jz.crm.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DedupGuardTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-10T12:00:00Z"));
    private final DedupGuard guard = new DedupGuard(new InMemoryKvBackend(clock), new DedupProperties());

    @Test
    void sameReplyWithinTtlIsDuplicate() {
        Duration ttl = Duration.ofSeconds(15);
        assertFalse(guard.isDuplicate("a", "Olá!", ttl));
        clock.advance(Duration.ofSeconds(14));
        assertTrue(guard.isDuplicate("a", "Olá!", ttl));
    }

    @Test
    void expiredFingerprintIsNotDuplicate() {
        Duration ttl = Duration.ofSeconds(15);
        assertFalse(guard.isDuplicate("a", "Olá!", ttl));
        clock.advance(Duration.ofSeconds(15));
        assertFalse(guard.isDuplicate("a", "Olá!", ttl));
    }

    @Test
    void differentReplyOverwritesFingerprint() {
        Duration ttl = Duration.ofSeconds(15);
        assertFalse(guard.isDuplicate("a", "um", ttl));
        assertFalse(guard.isDuplicate("a", "dois", ttl));
        assertFalse(guard.isDuplicate("a", "um", ttl));
    }

    @Test
    void blankKeyIsNeverDuplicate() {
        assertFalse(guard.isDuplicate("a", "", Duration.ofSeconds(15)));
        assertFalse(guard.isDuplicate("a", "", Duration.ofSeconds(15)));
    }

    @Test
    void appLinkRepliesShareOneKeyForAMinute() {
        DedupGuard.Key android = guard.keyFor("Baixe: https://play.google.com/store/apps/details?id=x");
        DedupGuard.Key ios = guard.keyFor("Baixe: https://apps.apple.com/br/app/gbi/id1");
        assertEquals("STATIC_KEY:APP_LINKS", android.value());
        assertEquals(android, ios);
        assertEquals(Duration.ofSeconds(60), android.ttl());

        assertFalse(guard.isDuplicate("a", android));
        clock.advance(Duration.ofSeconds(30));
        assertTrue(guard.isDuplicate("a", ios));
    }

    @Test
    void plainReplyIsKeyedByText() {
        DedupGuard.Key key = guard.keyFor("Olá!");
        assertEquals("Olá!", key.value());
        assertEquals(Duration.ofSeconds(15), key.ttl());
    }
}
