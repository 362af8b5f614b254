package com.whaleradar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Account age only moves forward by a day per day, so a long TTL is safe.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String ACCOUNT_AGE_CACHE = "accountAgeCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(ACCOUNT_AGE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
