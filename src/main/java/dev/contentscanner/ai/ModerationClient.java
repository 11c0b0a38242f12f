package dev.contentscanner.ai;

import dev.contentscanner.model.Media;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Scores one media item against the moderation categories of a provider.
 * Implementations are thin adapters; retries and timeouts belong to the caller.
 */
public interface ModerationClient {

    /**
     * Name used in logs and metrics (e.g., "sightengine").
     */
    String getName();

    /**
     * Analyze a single media item.
     *
     * @param media the media to score
     * @return Mono with category name to risk score in [0,1]; a category the
     *         provider did not report is mapped to null. Fails with
     *         {@link dev.contentscanner.exception.ProviderException}.
     */
    Mono<Map<String, Double>> analyze(Media media);
}
