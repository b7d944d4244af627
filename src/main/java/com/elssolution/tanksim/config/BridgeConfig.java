package com.elssolution.tanksim.config;

import com.elssolution.tanksim.alerts.AlertService;
import com.elssolution.tanksim.bridge.ExternalBridge;
import com.elssolution.tanksim.bridge.NoopEventBridge;
import com.elssolution.tanksim.bridge.RedisEventBridge;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Picks the external bridge: {@code replay.bridge.mode=none} (default) or {@code redis}.
 * The Redis connection itself comes from Spring Boot's spring.data.redis.* auto-configuration.
 */
@Slf4j
@Configuration
public class BridgeConfig {

    @Bean
    @ConditionalOnProperty(prefix = "replay.bridge", name = "mode", havingValue = "none", matchIfMissing = true)
    public ExternalBridge noopEventBridge() {
        log.info("External bridge disabled (replay.bridge.mode=none)");
        return new NoopEventBridge();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "replay.bridge", name = "mode", havingValue = "redis")
    static class RedisBridgeConfig {

        @Value("${replay.bridge.redis.channel:tank_events}")        private String channel;
        @Value("${replay.bridge.redis.latestKey:tank_latest_state}") private String latestKey;
        @Value("${replay.bridge.redis.outboundCapacity:10000}")     private int outboundCapacity;

        @Bean
        public RedisMessageListenerContainer replayListenerContainer(RedisConnectionFactory cf) {
            RedisMessageListenerContainer c = new RedisMessageListenerContainer();
            c.setConnectionFactory(cf);
            return c;
        }

        @Bean(destroyMethod = "shutdown")
        public RedisEventBridge redisEventBridge(StringRedisTemplate redis,
                                                 RedisMessageListenerContainer replayListenerContainer,
                                                 ObjectMapper mapper,
                                                 AlertService alerts) {
            return new RedisEventBridge(redis, replayListenerContainer, mapper, alerts,
                    channel, latestKey, outboundCapacity);
        }
    }
}
