package com.medicaledu.backend.global.cache;

import com.github.benmanes.caffeine.cache.Ticker;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

    @Bean
    public CacheService cacheService(CacheProperties properties) {
        return new MemoryCacheService(properties.getMaximumSize(), Ticker.systemTicker());
    }
}
