package com.hrms.backend.global.config;


import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

/**
 * Server-side scripts backing the atomic cache primitives. Each script is sent by SHA after the
 * first call.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    @Bean
    public RedisScript<Long> incrementWithExpiryScript() {
        return script("scripts/incr_with_expiry.lua", Long.class);
    }

    @Bean
    public RedisScript<String> slidingWindowScript() {
        return script("scripts/sliding_window.lua", String.class);
    }

    @Bean
    public RedisScript<Long> challengeStoreScript() {
        return script("scripts/challenge_store.lua", Long.class);
    }

    @Bean
    public RedisScript<Long> challengeConsumeScript() {
        return script("scripts/challenge_consume.lua", Long.class);
    }

    private static <T> RedisScript<T> script(String location, Class<T> resultType) {
        DefaultRedisScript<T> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource(location)));
        script.setResultType(resultType);
        return script;
    }
}
