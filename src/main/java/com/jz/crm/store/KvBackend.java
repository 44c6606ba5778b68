package com.jz.crm.store;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Key/value primitives shared by the context window, debounce markers, reply
 * fingerprints, sector queues and the online-operator set.
 * <p>
 * Every method is atomic with respect to other calls on the same key. Nothing
 * spans keys.
 */
public interface KvBackend {

    String get(String key);

    void set(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Returns {@code true} if the stored value equals {@code value} (the entry is left
     * untouched); otherwise stores {@code value} with {@code ttl} and returns {@code false}.
     */
    boolean compareOrSet(String key, String value, Duration ttl);

    /** Push to the tail, keep only the last {@code max} elements, reset the TTL. */
    void appendBounded(String key, String value, int max, Duration ttl);

    /** Whole list, head first. Empty when absent. */
    List<String> range(String key);

    void pushTail(String key, String value);

    /** Pops the head, or {@code null} when empty. */
    String popHead(String key);

    /** Removes every occurrence of {@code value}; returns how many were removed. */
    long removeAll(String key, String value);

    long length(String key);

    void setAdd(String key, String member);

    void setRemove(String key, String member);

    Set<String> setMembers(String key);

    /** Human-readable backend name for logs. */
    String name();
}
