package com.jz.crm.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local fallback used when Redis is unavailable. Lists and sets are kept
 * as immutable snapshots replaced inside {@link ConcurrentHashMap#compute}, which
 * makes every operation atomic per key. Expired entries are dropped lazily.
 */
public class InMemoryKvBackend implements KvBackend {

    private sealed interface Entry permits Text, Items, Members {
        Instant expiresAt();

        default boolean expired(Instant now) {
            return expiresAt() != null && !now.isBefore(expiresAt());
        }
    }

    private record Text(String value, Instant expiresAt) implements Entry {}

    private record Items(List<String> values, Instant expiresAt) implements Entry {}

    private record Members(Set<String> values, Instant expiresAt) implements Entry {}

    private final Map<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKvBackend(Clock clock) {
        this.clock = clock;
    }

    private Entry live(String key) {
        Entry e = store.get(key);
        if (e == null) return null;
        if (e.expired(clock.instant())) {
            store.remove(key, e);
            return null;
        }
        return e;
    }

    private Instant expiry(Duration ttl) {
        return (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : clock.instant().plus(ttl);
    }

    // a key holding another kind of value reads as empty
    private static List<String> listOf(Entry e) {
        return e instanceof Items items ? items.values() : List.of();
    }

    private static Set<String> setOf(Entry e) {
        return e instanceof Members members ? members.values() : Set.of();
    }

    private Entry current(Entry e) {
        return (e == null || e.expired(clock.instant())) ? null : e;
    }

    @Override
    public String get(String key) {
        Entry e = live(key);
        return e instanceof Text text ? text.value() : null;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        store.put(key, new Text(value, expiry(ttl)));
    }

    @Override
    public void delete(String key) {
        store.remove(key);
    }

    @Override
    public boolean compareOrSet(String key, String value, Duration ttl) {
        AtomicBoolean matched = new AtomicBoolean(false);
        store.compute(key, (k, old) -> {
            Entry cur = current(old);
            if (cur instanceof Text text && Objects.equals(text.value(), value)) {
                matched.set(true);
                return cur;
            }
            return new Text(value, expiry(ttl));
        });
        return matched.get();
    }

    @Override
    public void appendBounded(String key, String value, int max, Duration ttl) {
        store.compute(key, (k, old) -> {
            List<String> next = new ArrayList<>(listOf(current(old)));
            next.add(value);
            if (max > 0 && next.size() > max) {
                next = next.subList(next.size() - max, next.size());
            }
            return new Items(List.copyOf(next), expiry(ttl));
        });
    }

    @Override
    public List<String> range(String key) {
        return listOf(live(key));
    }

    @Override
    public void pushTail(String key, String value) {
        store.compute(key, (k, old) -> {
            Entry cur = current(old);
            List<String> next = new ArrayList<>(listOf(cur));
            next.add(value);
            return new Items(List.copyOf(next), cur == null ? null : cur.expiresAt());
        });
    }

    @Override
    public String popHead(String key) {
        AtomicReference<String> head = new AtomicReference<>();
        store.computeIfPresent(key, (k, old) -> {
            Entry cur = current(old);
            List<String> list = listOf(cur);
            if (list.isEmpty()) return null;
            head.set(list.get(0));
            List<String> rest = list.subList(1, list.size());
            return rest.isEmpty() ? null : new Items(List.copyOf(rest), cur.expiresAt());
        });
        return head.get();
    }

    @Override
    public long removeAll(String key, String value) {
        AtomicLong removed = new AtomicLong();
        store.computeIfPresent(key, (k, old) -> {
            Entry cur = current(old);
            List<String> list = listOf(cur);
            List<String> kept = new ArrayList<>(list.size());
            for (String s : list) {
                if (s.equals(value)) removed.incrementAndGet();
                else kept.add(s);
            }
            return kept.isEmpty() ? null : new Items(List.copyOf(kept), cur.expiresAt());
        });
        return removed.get();
    }

    @Override
    public long length(String key) {
        return listOf(live(key)).size();
    }

    @Override
    public void setAdd(String key, String member) {
        store.compute(key, (k, old) -> {
            Set<String> next = new LinkedHashSet<>(setOf(current(old)));
            next.add(member);
            return new Members(Set.copyOf(next), null);
        });
    }

    @Override
    public void setRemove(String key, String member) {
        store.computeIfPresent(key, (k, old) -> {
            Set<String> next = new LinkedHashSet<>(setOf(current(old)));
            next.remove(member);
            return next.isEmpty() ? null : new Members(Set.copyOf(next), null);
        });
    }

    @Override
    public Set<String> setMembers(String key) {
        return setOf(live(key));
    }

    @Override
    public String name() {
        return "memory";
    }
}
