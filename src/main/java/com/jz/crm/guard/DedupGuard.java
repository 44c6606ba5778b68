package com.jz.crm.guard;

import com.jz.crm.config.DedupProperties;
import com.jz.crm.store.KvBackend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Suppresses a reply equal to the one last sent to the same customer within a short TTL.
 * Only an MD5 fingerprint of the key is stored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedupGuard {

    private final KvBackend backend;
    private final DedupProperties props;

    /** Dedup key and TTL chosen for a candidate reply. */
    public record Key(String value, Duration ttl) {}

    private String k(String address) { return props.getKeyPrefix() + address; }

    /**
     * Replies carrying an app-store link are interchangeable, so they all share one
     * static key with a longer TTL. Anything else is keyed by its literal text.
     */
    public Key keyFor(String reply) {
        if (reply != null) {
            for (String marker : props.getAppLinkMarkers()) {
                if (reply.contains(marker)) {
                    return new Key(props.getAppLinkKey(), props.getAppLinkTtl());
                }
            }
        }
        return new Key(reply, props.getDefaultTtl());
    }

    /**
     * @return {@code true} when the same fingerprint is already stored (caller must not send);
     *         otherwise stores this fingerprint with {@code ttl} and returns {@code false}
     */
    public boolean isDuplicate(String address, String key, Duration ttl) {
        if (!StringUtils.hasText(key)) return false;
        String fingerprint = DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
        try {
            return backend.compareOrSet(k(address), fingerprint, ttl);
        } catch (Exception e) {
            log.error("[Dedup] check failed, address={}, err={}", address, e.getMessage());
            return false;
        }
    }

    public boolean isDuplicate(String address, Key key) {
        return isDuplicate(address, key.value(), key.ttl());
    }
}
