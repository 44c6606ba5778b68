package com.jz.crm.config;

import com.jz.crm.store.InMemoryKvBackend;
import com.jz.crm.store.KvBackend;
import com.jz.crm.store.RedisKvBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public KvBackend kvBackend(StoreProperties props,
                               StringRedisTemplate redis,
                               DefaultRedisScript<Long> compareOrSetScript,
                               DefaultRedisScript<Long> appendBoundedScript,
                               Clock clock) {
        return switch (props.getBackend()) {
            case MEMORY -> {
                log.info("[Store] using in-memory backend (configured)");
                yield new InMemoryKvBackend(clock);
            }
            case REDIS -> new RedisKvBackend(redis, compareOrSetScript, appendBoundedScript);
            case AUTO -> {
                if (redisReachable(redis)) {
                    log.info("[Store] Redis reachable, using redis backend");
                    yield new RedisKvBackend(redis, compareOrSetScript, appendBoundedScript);
                }
                log.warn("[Store] Redis not reachable, falling back to in-memory backend");
                yield new InMemoryKvBackend(clock);
            }
        };
    }

    private static boolean redisReachable(StringRedisTemplate redis) {
        try (RedisConnection c = redis.getRequiredConnectionFactory().getConnection()) {
            return "PONG".equalsIgnoreCase(c.ping());
        } catch (Exception e) {
            log.warn("[Store] Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
