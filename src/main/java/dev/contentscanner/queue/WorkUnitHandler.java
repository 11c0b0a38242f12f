package dev.contentscanner.queue;

import reactor.core.publisher.Mono;

/**
 * Consumer side of the work queue. Must be idempotent: a unit may be delivered more than once.
 */
@FunctionalInterface
public interface WorkUnitHandler {

    Mono<Void> handle(WorkUnit unit);

    /**
     * Called once when a unit is dropped after its last allowed delivery failed.
     */
    default Mono<Void> onExhausted(WorkUnit unit, Throwable cause) {
        return Mono.empty();
    }
}
