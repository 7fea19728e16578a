package com.autonomous.dogwalker.config;

import com.autonomous.dogwalker.store.CoordinationStore;
import com.autonomous.dogwalker.store.InMemoryCoordinationStore;
import com.autonomous.dogwalker.store.RedisCoordinationStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "dogwalker.store.type", havingValue = "redis")
    public CoordinationStore redisCoordinationStore(StringRedisTemplate redisTemplate) {
        return new RedisCoordinationStore(redisTemplate);
    }

    // Single-process deployments and tests.
    @Bean
    @ConditionalOnProperty(name = "dogwalker.store.type", havingValue = "memory", matchIfMissing = true)
    public CoordinationStore inMemoryCoordinationStore(Clock clock) {
        return new InMemoryCoordinationStore(clock);
    }
}
