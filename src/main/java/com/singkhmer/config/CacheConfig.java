package com.singkhmer.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class CacheConfig {

    // normalized input -> top suggestions; cleared whenever a choice is learned
    @Bean("suggestionCache")
    public Cache<String, List<String>> suggestionCache(TransliteratorProperties properties) {
        TransliteratorProperties.Cache cache = properties.getCache();
        return Caffeine.newBuilder()
                .maximumSize(cache.getMaximumSize())
                .expireAfterWrite(cache.getExpireAfterWrite())
                .build();
    }
}
