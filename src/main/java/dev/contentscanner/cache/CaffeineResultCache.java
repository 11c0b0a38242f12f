package dev.contentscanner.cache;

import com.github.benmanes.caffeine.cache.Cache;
import dev.contentscanner.model.MediaResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * In-process result cache. Size and TTL bounds come from {@code analysis.cache}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CaffeineResultCache implements ResultCache {

    private final Cache<String, MediaResult> mediaResultStore;

    @Override
    public Optional<MediaResult> get(String fingerprint) {
        return Optional.ofNullable(mediaResultStore.getIfPresent(fingerprint));
    }

    @Override
    public void put(String fingerprint, MediaResult result) {
        // First write wins
        MediaResult existing = mediaResultStore.asMap().putIfAbsent(fingerprint, result);
        if (existing != null) {
            log.debug("Cache entry for {} already present, keeping original", fingerprint);
        }
    }

    public long size() {
        return mediaResultStore.estimatedSize();
    }
}
