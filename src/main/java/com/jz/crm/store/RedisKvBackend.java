package com.jz.crm.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Redis implementation. Single commands are atomic already; the two composite
 * operations run as Lua scripts.
 */
@RequiredArgsConstructor
public class RedisKvBackend implements KvBackend {

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> compareOrSetScript;
    private final DefaultRedisScript<Long> appendBoundedScript;

    @Override
    public String get(String key) {
        return redis.opsForValue().get(key);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }

    @Override
    public void delete(String key) {
        redis.delete(key);
    }

    @Override
    public boolean compareOrSet(String key, String value, Duration ttl) {
        Long res = redis.execute(compareOrSetScript, List.of(key), value, String.valueOf(ttl.toMillis()));
        return res != null && res == 1L;
    }

    @Override
    public void appendBounded(String key, String value, int max, Duration ttl) {
        redis.execute(appendBoundedScript, List.of(key), value, String.valueOf(max), String.valueOf(ttl.toMillis()));
    }

    @Override
    public List<String> range(String key) {
        List<String> out = redis.opsForList().range(key, 0, -1);
        return out == null ? List.of() : out;
    }

    @Override
    public void pushTail(String key, String value) {
        redis.opsForList().rightPush(key, value);
    }

    @Override
    public String popHead(String key) {
        return redis.opsForList().leftPop(key);
    }

    @Override
    public long removeAll(String key, String value) {
        Long n = redis.opsForList().remove(key, 0, value);   // LREM count=0 -> all occurrences
        return n == null ? 0 : n;
    }

    @Override
    public long length(String key) {
        Long n = redis.opsForList().size(key);
        return n == null ? 0 : n;
    }

    @Override
    public void setAdd(String key, String member) {
        redis.opsForSet().add(key, member);
    }

    @Override
    public void setRemove(String key, String member) {
        redis.opsForSet().remove(key, member);
    }

    @Override
    public Set<String> setMembers(String key) {
        Set<String> out = redis.opsForSet().members(key);
        return out == null ? Set.of() : out;
    }

    @Override
    public String name() {
        return "redis";
    }
}
