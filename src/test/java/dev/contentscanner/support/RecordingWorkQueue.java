package dev.contentscanner.support;

import dev.contentscanner.exception.DispatchException;
import dev.contentscanner.queue.WorkQueue;
import dev.contentscanner.queue.WorkUnit;
import dev.contentscanner.queue.WorkUnitHandler;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Queue double that keeps published units until the test drains them.
 */
public class RecordingWorkQueue implements WorkQueue {

    private final List<WorkUnit> pending = new ArrayList<>();
    private final List<WorkUnit> published = new ArrayList<>();
    private int acceptLimit = Integer.MAX_VALUE;
    private boolean running;

    @Override
    public synchronized Mono<Void> publish(WorkUnit unit) {
        if (published.size() >= acceptLimit) {
            return Mono.error(new DispatchException("broker unavailable"));
        }
        published.add(unit);
        pending.add(unit);
        return Mono.empty();
    }

    @Override
    public void start(WorkUnitHandler handler) {
        running = true;
    }

    @Override
    public void stop() {
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Only the first {@code limit} publishes succeed; later ones fail.
     */
    public synchronized void acceptOnly(int limit) {
        this.acceptLimit = limit;
    }

    public synchronized List<WorkUnit> published() {
        return List.copyOf(published);
    }

    /**
     * Hand every pending unit to the handler, one after the other.
     */
    public void drain(WorkUnitHandler handler) {
        List<WorkUnit> batch;
        synchronized (this) {
            batch = List.copyOf(pending);
            pending.clear();
        }
        for (WorkUnit unit : batch) {
            handler.handle(unit).block();
        }
    }

    public synchronized List<WorkUnit> takePending() {
        List<WorkUnit> batch = List.copyOf(pending);
        pending.clear();
        return batch;
    }
}
