package fun.fengwk.lss.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Fixed-size browser worker pool with one session per worker.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>Workers are started on construction and live until {@link #shutdown()}.</li>
 *     <li>Each worker drains the shared FIFO queue, acquiring its own session lazily from the
 *     {@link BrowserSessionRegistry} and running one task at a time.</li>
 *     <li>Every submitted task yields exactly one result: failures are mapped by a
 *     {@link TaskFallback} instead of being propagated.</li>
 *     <li>On shutdown each worker closes its own session on its own thread; sessions of workers
 *     that do not exit in time are force-released by the pool.</li>
 * </ul>
 *
 * @author fengwk
 */
public class BrowserWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BrowserWorkerPool.class);

    private final WorkerPoolConfig config;
    private final BrowserSessionRegistry sessionRegistry;
    private final BlockingQueue<WorkItem<?, ?>> queue = new LinkedBlockingQueue<>();
    private final List<Thread> workerThreads = new CopyOnWriteArrayList<>();
    private final CountDownLatch workersExited;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final Object submitLock = new Object();

    public BrowserWorkerPool(WorkerPoolConfig config, BrowserSessionFactory sessionFactory) {
        if (config == null || config.getWorkerCount() < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1");
        }
        this.config = config;
        this.sessionRegistry = new BrowserSessionRegistry(sessionFactory, config.getWorkerCount());
        this.workersExited = new CountDownLatch(config.getWorkerCount());
        startWorkers();
    }

    BrowserSessionRegistry getSessionRegistry() {
        return sessionRegistry;
    }

    /**
     * Run every task and block until each one has produced its result.
     *
     * <p>Results are handed to {@code resultConsumer} in completion order, from worker threads.
     * The consumer must be thread-safe.
     *
     * @param tasks tasks to run, no {@code null} elements
     * @param task task body, executed with the worker's own session
     * @param fallback result for a task whose session acquisition or body failed
     * @param resultConsumer receives each result exactly once
     */
    public <T, R> void execute(
        List<T> tasks,
        BrowserSessionTask<T, R> task,
        TaskFallback<T, R> fallback,
        Consumer<R> resultConsumer
    ) {
        if (shutdown.get()) {
            throw new IllegalStateException("browser worker pool is shutdown");
        }
        if (tasks.isEmpty()) {
            return;
        }

        Batch<T, R> batch = new Batch<>(tasks.size(), task, fallback, resultConsumer);
        for (T item : tasks) {
            if (item == null) {
                throw new IllegalArgumentException("tasks must not contain null");
            }
        }
        // Shared with the shutdown drain: a batch is either fully queued before the drain or rejected.
        synchronized (submitLock) {
            if (shutdown.get()) {
                throw new IllegalStateException("browser worker pool is shutdown");
            }
            for (T item : tasks) {
                queue.add(new WorkItem<>(item, batch));
            }
        }
        log.debug("submitted {} tasks to {} browser workers", tasks.size(), config.getWorkerCount());

        try {
            batch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for browser workers, pending={}", batch.pending());
            throw new IllegalStateException("interrupted while waiting for browser workers", ex);
        }

        RuntimeException failure = batch.failure();
        if (failure != null) {
            throw failure;
        }
    }

    public void shutdown() {
        List<WorkItem<?, ?>> pending = new ArrayList<>();
        synchronized (submitLock) {
            if (!shutdown.compareAndSet(false, true)) {
                return;
            }
            queue.drainTo(pending);
        }
        log.info("shutting down browser worker pool, workers={}, pending={}", config.getWorkerCount(), pending.size());

        // Tasks still queued are completed with the fallback so callers keep one result per task.
        for (WorkItem<?, ?> item : pending) {
            item.fail(new IllegalStateException("browser worker pool is shutting down"));
        }

        try {
            if (!workersExited.await(config.getShutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("browser workers did not exit in {}ms, forcing session release", config.getShutdownTimeoutMs());
                workerThreads.forEach(Thread::interrupt);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while waiting for browser workers to exit");
        }

        sessionRegistry.releaseAll();
        log.info("browser worker pool shutdown completed");
    }

    @Override
    public void close() {
        shutdown();
    }

    private void startWorkers() {
        for (int workerId = 0; workerId < config.getWorkerCount(); workerId++) {
            Thread thread = new Thread(new Worker(workerId));
            thread.setName("lss-browser-worker-" + workerId);
            thread.setDaemon(true);
            workerThreads.add(thread);
            thread.start();
        }
    }

    private static final class Batch<T, R> {

        private final CountDownLatch remaining;
        private final BrowserSessionTask<T, R> task;
        private final TaskFallback<T, R> fallback;
        private final Consumer<R> resultConsumer;
        private volatile RuntimeException failure;

        private Batch(int size, BrowserSessionTask<T, R> task, TaskFallback<T, R> fallback, Consumer<R> resultConsumer) {
            this.remaining = new CountDownLatch(size);
            this.task = task;
            this.fallback = fallback;
            this.resultConsumer = resultConsumer;
        }

        private void await() throws InterruptedException {
            remaining.await();
        }

        private long pending() {
            return remaining.getCount();
        }

        private RuntimeException failure() {
            return failure;
        }

        private synchronized void recordFailure(Throwable ex) {
            if (failure == null) {
                failure = ex instanceof RuntimeException
                    ? (RuntimeException) ex
                    : new IllegalStateException(ex.toString(), ex);
            }
        }

    }

    private static final class WorkItem<T, R> {

        private final T task;
        private final Batch<T, R> batch;

        private WorkItem(T task, Batch<T, R> batch) {
            this.task = task;
            this.batch = batch;
        }

        private void run(int workerId, BrowserSessionRegistry sessionRegistry) {
            R result;
            try {
                BrowserSession session = sessionRegistry.acquireSession(workerId);
                result = batch.task.execute(task, session);
            } catch (Exception ex) {
                log.debug("browser task failed, workerId={}, error={}", workerId, ex.getMessage());
                complete(ex);
                return;
            } catch (Throwable err) {
                // Errors such as a broken driver install must not kill the worker or stall the batch.
                log.warn("browser task failed with error, workerId={}, error={}", workerId, err.toString(), err);
                complete(new IllegalStateException(err.toString(), err));
                return;
            }
            deliver(result);
        }

        private void fail(Exception cause) {
            complete(cause);
        }

        private void complete(Exception cause) {
            R result;
            try {
                result = batch.fallback.onFailure(task, cause);
            } catch (RuntimeException | Error ex) {
                log.warn("task fallback failed, error={}", ex.getMessage(), ex);
                batch.recordFailure(ex);
                batch.remaining.countDown();
                return;
            }
            deliver(result);
        }

        private void deliver(R result) {
            try {
                batch.resultConsumer.accept(result);
            } catch (RuntimeException | Error ex) {
                log.warn("result consumer failed, error={}", ex.getMessage(), ex);
                batch.recordFailure(ex);
            } finally {
                batch.remaining.countDown();
            }
        }

    }

    private class Worker implements Runnable {

        private final int workerId;

        private Worker(int workerId) {
            this.workerId = workerId;
        }

        @Override
        public void run() {
            try {
                loop();
            } catch (Exception ex) {
                log.warn("browser worker terminated unexpectedly, workerId={}", workerId, ex);
            } finally {
                sessionRegistry.releaseSession(workerId);
                workersExited.countDown();
            }
        }

        private void loop() {
            long pollIntervalMs = Math.max(1L, config.getPollIntervalMs());
            while (!shutdown.get()) {
                WorkItem<?, ?> item;
                try {
                    // Polling interval also gates shutdown checks.
                    item = queue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (item == null) {
                    continue;
                }
                item.run(workerId, sessionRegistry);
            }
        }

    }

}
