package com.jz.crm.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.springframework.data.redis.core.script.DefaultRedisScript;

@Configuration
public class RedisScriptsConfig {

    /** Returns 1 if GET key == ARGV[1]; otherwise SET key ARGV[1] PX ARGV[2] and return 0 */
    @Bean
    public DefaultRedisScript<Long> compareOrSetScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText(
                "local old = redis.call('get', KEYS[1]) " +
                        "if old == ARGV[1] then return 1 end " +
                        "redis.call('set', KEYS[1], ARGV[1], 'PX', ARGV[2]) " +
                        "return 0"
        );
        return s;
    }

    /** RPUSH + LTRIM to the last ARGV[2] + PEXPIRE ARGV[3], as one step */
    @Bean
    public DefaultRedisScript<Long> appendBoundedScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText(
                "redis.call('rpush', KEYS[1], ARGV[1]) " +
                        "redis.call('ltrim', KEYS[1], -tonumber(ARGV[2]), -1) " +
                        "if tonumber(ARGV[3]) > 0 then redis.call('pexpire', KEYS[1], ARGV[3]) end " +
                        "return redis.call('llen', KEYS[1])"
        );
        return s;
    }
}
