package dev.contentscanner.service;

import dev.contentscanner.ai.ModerationClient;
import dev.contentscanner.cache.ResultCache;
import dev.contentscanner.config.AnalysisConfig;
import dev.contentscanner.exception.ProviderException;
import dev.contentscanner.metrics.AnalysisMetrics;
import dev.contentscanner.model.ErrorKind;
import dev.contentscanner.model.Media;
import dev.contentscanner.model.MediaError;
import dev.contentscanner.model.MediaResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Runs moderation for one media item and always resolves it to a result or an error.
 * <p>
 * Steps: fingerprint, known-safe pre-check, cache lookup, provider call with
 * timeout and bounded retries, classification, cache write. Concurrent requests
 * for the same fingerprint share a single provider call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MediaWorker {

    private final ModerationClient moderationClient;
    private final ResultCache resultCache;
    private final ContentFingerprinter fingerprinter;
    private final ScoreClassifier scoreClassifier;
    private final AnalysisConfig analysisConfig;
    private final AnalysisMetrics metrics;

    private final Map<String, Mono<MediaResult>> inFlight = new ConcurrentHashMap<>();

    /**
     * Resolve a media item. The returned Mono never errors.
     *
     * @param media the pending media item
     * @return Mono with the same media carrying either a result or an error
     */
    public Mono<Media> process(Media media) {
        String fingerprint;
        try {
            fingerprint = fingerprinter.fingerprint(media);
        } catch (IllegalArgumentException e) {
            return Mono.just(fail(media, new MediaError(ErrorKind.INVALID_MEDIA, e.getMessage())));
        }

        if (analysisConfig.getKnownSafeFingerprints().contains(fingerprint)) {
            log.debug("Media {} matches a known-safe fingerprint, skipping provider call", media.mediaId());
            metrics.recordMediaSkipped();
            return Mono.just(media.withResult(MediaResult.knownSafe(fingerprint)));
        }

        Optional<MediaResult> cached = resultCache.get(fingerprint);
        if (cached.isPresent()) {
            log.debug("Cache hit for media {} ({})", media.mediaId(), fingerprint);
            metrics.recordCacheHit();
            metrics.recordMediaAnalyzed();
            return Mono.just(media.withResult(cached.get()));
        }
        metrics.recordCacheMiss();

        return inFlight.computeIfAbsent(fingerprint, key -> resultCache.get(key)
                        .map(Mono::just)
                        .orElseGet(() -> moderate(media, key))
                        .doFinally(signal -> inFlight.remove(key))
                        .cache())
                .map(media::withResult)
                .doOnNext(resolved -> metrics.recordMediaAnalyzed())
                .onErrorResume(e -> Mono.just(fail(media, toMediaError(e))));
    }

    private Mono<MediaResult> moderate(Media media, String fingerprint) {
        return Mono.defer(() -> {
                    long start = System.nanoTime();
                    return moderationClient.analyze(media)
                            .timeout(analysisConfig.getModerationTimeout())
                            .switchIfEmpty(Mono.error(() -> ProviderException.providerError(
                                    moderationClient.getName() + " returned no scores")))
                            .onErrorMap(TimeoutException.class, e -> ProviderException.timeout(
                                    moderationClient.getName() + " did not answer within "
                                            + analysisConfig.getModerationTimeout(), e))
                            .doFinally(signal -> metrics.recordProviderLatency(
                                    moderationClient.getName(), Duration.ofNanos(System.nanoTime() - start)));
                })
                .retryWhen(Retry.backoff(analysisConfig.getRetryLimit(), analysisConfig.getRetryBackoff())
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> log.info("Retrying moderation for media {} (attempt {}): {}",
                                media.mediaId(), signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .map(scores -> new MediaResult(scores, scoreClassifier.classifyAll(scores), fingerprint, false))
                .doOnNext(result -> resultCache.put(fingerprint, result));
    }

    private boolean isRetryable(Throwable e) {
        return e instanceof ProviderException providerException && providerException.isRetryable();
    }

    private MediaError toMediaError(Throwable e) {
        if (e instanceof ProviderException providerException) {
            return new MediaError(providerException.getKind(), providerException.getMessage());
        }
        return new MediaError(ErrorKind.PROVIDER_ERROR, e.getMessage());
    }

    private Media fail(Media media, MediaError error) {
        log.warn("Media {} failed analysis ({}): {}", media.mediaId(), error.reason(), error.message());
        metrics.recordMediaErrored(error.reason());
        return media.withError(error);
    }
}
