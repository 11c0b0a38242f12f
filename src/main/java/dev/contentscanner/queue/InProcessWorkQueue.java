package dev.contentscanner.queue;

import dev.contentscanner.config.AnalysisConfig;
import dev.contentscanner.exception.DispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Work queue backed by a Reactor sink, consumed with bounded concurrency.
 * <p>
 * A unit whose handler fails is redelivered after a short delay, up to
 * {@code analysis.max-redeliveries} times, then handed to
 * {@link WorkUnitHandler#onExhausted}. The queue is single-use: once
 * stopped it cannot be started again.
 */
@Slf4j
@Component
public class InProcessWorkQueue implements WorkQueue {

    private static final Duration EMIT_TIMEOUT = Duration.ofMillis(200);

    private final Sinks.Many<WorkUnit> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicReference<Disposable> subscription = new AtomicReference<>();
    private final int concurrency;
    private final int maxRedeliveries;
    private final Duration redeliveryDelay;

    private volatile boolean stopped;

    public InProcessWorkQueue(AnalysisConfig analysisConfig) {
        this.concurrency = Math.max(1, analysisConfig.getWorkerConcurrency());
        this.maxRedeliveries = Math.max(0, analysisConfig.getMaxRedeliveries());
        this.redeliveryDelay = analysisConfig.getRetryBackoff();
    }

    @Override
    public Mono<Void> publish(WorkUnit unit) {
        return Mono.fromRunnable(() -> emit(unit));
    }

    private void emit(WorkUnit unit) {
        if (stopped) {
            throw new DispatchException("Work queue is stopped, cannot enqueue " + unit.idempotencyKey());
        }
        try {
            sink.emitNext(unit, Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT));
        } catch (Sinks.EmissionException e) {
            throw new DispatchException("Failed to enqueue " + unit.idempotencyKey() + ": " + e.getReason(), e);
        }
        log.debug("Enqueued work unit {} (delivery {})", unit.idempotencyKey(), unit.delivery());
    }

    @Override
    public void start(WorkUnitHandler handler) {
        if (stopped) {
            throw new IllegalStateException("Work queue has been stopped");
        }
        Disposable consumer = sink.asFlux()
                .flatMap(unit -> deliver(handler, unit), concurrency)
                .subscribe(
                        ignored -> { },
                        e -> log.error("Work queue consumer terminated: {}", e.getMessage(), e));
        if (!subscription.compareAndSet(null, consumer)) {
            consumer.dispose();
            throw new IllegalStateException("Work queue already started");
        }
        log.info("Work queue started (concurrency: {}, max redeliveries: {})", concurrency, maxRedeliveries);
    }

    private Mono<Void> deliver(WorkUnitHandler handler, WorkUnit unit) {
        return Mono.defer(() -> handler.handle(unit))
                .onErrorResume(e -> {
                    if (unit.delivery() >= maxRedeliveries) {
                        log.error("Dropping work unit {} after {} deliveries: {}",
                                unit.idempotencyKey(), unit.delivery() + 1, e.getMessage());
                        return Mono.defer(() -> handler.onExhausted(unit, e))
                                .onErrorResume(deadLetterError -> {
                                    log.error("Exhausted handler failed for {}: {}",
                                            unit.idempotencyKey(), deadLetterError.getMessage());
                                    return Mono.empty();
                                });
                    }
                    log.warn("Handler failed for {} (delivery {}), redelivering: {}",
                            unit.idempotencyKey(), unit.delivery() + 1, e.getMessage());
                    return Mono.delay(redeliveryDelay)
                            .then(publish(unit.redelivered()))
                            .onErrorResume(publishError -> {
                                log.error("Redelivery of {} failed: {}", unit.idempotencyKey(), publishError.getMessage());
                                return Mono.empty();
                            });
                });
    }

    @Override
    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        sink.tryEmitComplete();
        Disposable consumer = subscription.getAndSet(null);
        if (consumer != null) {
            consumer.dispose();
        }
        log.info("Work queue stopped");
    }

    @Override
    public boolean isRunning() {
        return !stopped && subscription.get() != null;
    }
}
