package org.rostilos.gitlabsync.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools of one run. The worker pool runs the per-item units and is bounded by the configured
 * concurrency; the coordinator pool runs the fetch passes that wait on those units.
 */
public class WorkerPools implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPools.class);

    static final int COORDINATOR_THREADS = 4;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ExecutorService workers;
    private final ExecutorService coordinator;

    public WorkerPools(int concurrency) {
        this.workers = Executors.newFixedThreadPool(concurrency, namedThreads("gitlab-sync-worker-"));
        this.coordinator = Executors.newFixedThreadPool(COORDINATOR_THREADS, namedThreads("gitlab-sync-fetch-"));
    }

    public ExecutorService workers() {
        return workers;
    }

    public ExecutorService coordinator() {
        return coordinator;
    }

    @Override
    public void close() {
        coordinator.shutdown();
        workers.shutdown();
        try {
            if (!coordinator.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    || !workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker pools did not terminate in {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                coordinator.shutdownNow();
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinator.shutdownNow();
            workers.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
