package com.hivestate.core.cache;

import com.hivestate.core.store.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Provides the {@link EphemeralStore}: Redis-backed when a template is available and
 * {@code hivestate.cache.enabled} is true, otherwise the always-unavailable stand-in.
 */
@Configuration
public class EphemeralStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(EphemeralStoreConfig.class);

    @Bean
    public EphemeralStore ephemeralStore(ObjectProvider<StringRedisTemplate> redisTemplate, JsonCodec jsonCodec,
                                         Clock clock, EphemeralStoreProperties properties) {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (!properties.isEnabled() || template == null) {
            log.info("Ephemeral store disabled; state layer runs in degraded mode");
            return new UnavailableEphemeralStore(clock);
        }
        log.info("Configuring Redis ephemeral store (stream max length {})", properties.getStreamMaxLength());
        return new RedisEphemeralStore(template, jsonCodec, clock, properties);
    }
}
