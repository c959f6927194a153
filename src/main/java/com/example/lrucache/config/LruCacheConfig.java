package com.example.lrucache.config;

import com.example.lrucache.core.LruCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LruCacheProperties.class)
public class LruCacheConfig {

    @Bean
    public LruCache<String, String> lruCache(LruCacheProperties properties) {
        // non-positive capacity fails startup here
        return new LruCache<>(properties.getCapacity());
    }
}
