package dev.contentscanner.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.contentscanner.model.MediaResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Caffeine store behind the media result cache.
 */
@Configuration
public class CacheConfig {

    @Bean
    public Cache<String, MediaResult> mediaResultStore(AnalysisConfig analysisConfig) {
        return Caffeine.newBuilder()
                .maximumSize(analysisConfig.getCache().getMaxSize())
                .expireAfterWrite(analysisConfig.getCache().getTtl())
                .recordStats()
                .build();
    }
}
