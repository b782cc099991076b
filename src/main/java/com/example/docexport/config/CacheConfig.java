package com.example.docexport.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caches remote images/thumbnails fetched during rendering and the
 * style-merge templates read from disk.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String REMOTE_BLOBS = "remoteBlobs";
    public static final String STYLE_TEMPLATES = "styleTemplates";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(REMOTE_BLOBS, STYLE_TEMPLATES);
        manager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(500)
                .expireAfterWrite(Duration.ofMinutes(30))
                .recordStats());
        return manager;
    }
}
