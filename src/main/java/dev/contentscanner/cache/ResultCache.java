package dev.contentscanner.cache;

import dev.contentscanner.model.MediaResult;

import java.util.Optional;

/**
 * Content-addressed store of media results, keyed by content fingerprint.
 * Entries are never updated in place.
 */
public interface ResultCache {

    Optional<MediaResult> get(String fingerprint);

    void put(String fingerprint, MediaResult result);
}
