package dev.contentscanner.queue;

import reactor.core.publisher.Mono;

/**
 * At-least-once work queue for media analysis units.
 */
public interface WorkQueue {

    /**
     * Enqueue a unit. Completes once the queue has accepted it.
     *
     * @return Mono that fails with {@link dev.contentscanner.exception.DispatchException}
     *         when the unit cannot be enqueued
     */
    Mono<Void> publish(WorkUnit unit);

    /**
     * Begin delivering units to the handler.
     */
    void start(WorkUnitHandler handler);

    /**
     * Stop delivering units. Publishing after stop fails.
     */
    void stop();

    boolean isRunning();
}
