package dev.contentscanner;

import dev.contentscanner.queue.WorkQueue;
import dev.contentscanner.queue.WorkUnit;
import dev.contentscanner.queue.WorkUnitHandler;
import dev.contentscanner.service.JobOrchestrator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Connects the work queue to the job orchestrator for the lifetime of the application.
 * Separated from the main Application class so tests can run without consumers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueConsumerRunner {

    private final WorkQueue workQueue;
    private final JobOrchestrator jobOrchestrator;

    public void start() {
        if (workQueue.isRunning()) {
            log.debug("Work queue consumer already running");
            return;
        }
        workQueue.start(new WorkUnitHandler() {
            @Override
            public Mono<Void> handle(WorkUnit unit) {
                return jobOrchestrator.handle(unit);
            }

            @Override
            public Mono<Void> onExhausted(WorkUnit unit, Throwable cause) {
                return jobOrchestrator.abandon(unit, cause);
            }
        });
    }

    @PreDestroy
    public void stop() {
        workQueue.stop();
    }
}
