package dev.contentscanner.ai;

import dev.contentscanner.model.AggregateResult;
import reactor.core.publisher.Mono;

/**
 * Turns an aggregate moderation result into text for a non-technical reviewer.
 */
public interface SummaryClient {

    /**
     * Produce a short human-readable summary.
     *
     * @param result the terminal aggregate of a job
     * @return Mono with the summary text; fails with
     *         {@link dev.contentscanner.exception.ProviderException}
     */
    Mono<String> summarize(AggregateResult result);

    /**
     * Check if the summary provider is configured.
     */
    boolean isEnabled();
}
