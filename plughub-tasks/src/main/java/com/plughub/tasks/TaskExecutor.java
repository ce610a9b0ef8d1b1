package com.plughub.tasks;

import com.plughub.annotations.ResourceCleanup;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded worker pool for long operations (downloads, installs, plugin processing).
 * <p>
 * Every submitted task ends with exactly one of {@code onResult} / {@code onError}, followed by
 * {@code onFinished}, all on the worker thread. Exceptions thrown by the task or by a callback are
 * logged and never reach the pool. A cancelled {@link TaskHandle} still runs its work; only the
 * callbacks are skipped. Tasks still queued when a shutdown gives up waiting are reported through
 * {@code onError} and {@code onFinished}.
 */
public final class TaskExecutor implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final String TIMER_NAME = "plughub.task.duration";
    private static final Duration DEFAULT_SHUTDOWN_WAIT = Duration.ofSeconds(5);

    private final ThreadPoolExecutor pool;
    private final MeterRegistry meterRegistry;
    private final AtomicLong ids = new AtomicLong();

    private final ReentrantLock idleLock = new ReentrantLock();
    private final Condition idle = idleLock.newCondition();
    private int pending;

    public TaskExecutor() {
        this(defaultMaxWorkers(), new SimpleMeterRegistry());
    }

    public TaskExecutor(int maxWorkers, MeterRegistry meterRegistry) {
        int workers = maxWorkers > 0 ? maxWorkers : defaultMaxWorkers();
        this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
        this.pool = new ThreadPoolExecutor(workers, workers, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), new WorkerThreadFactory());
        this.pool.allowCoreThreadTimeOut(true);
        log.info("Task executor created with {} workers", workers);
    }

    /** Available processors, at least 2. */
    public static int defaultMaxWorkers() {
        return Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Changes the pool size. Queued tasks are kept; running ones are not affected.
     *
     * @throws IllegalArgumentException if maxWorkers is less than 1
     */
    public synchronized void configure(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1: " + maxWorkers);
        }
        // core must never exceed max, so the order depends on the direction
        if (maxWorkers > pool.getMaximumPoolSize()) {
            pool.setMaximumPoolSize(maxWorkers);
            pool.setCorePoolSize(maxWorkers);
        } else {
            pool.setCorePoolSize(maxWorkers);
            pool.setMaximumPoolSize(maxWorkers);
        }
        log.info("Task executor resized to {} workers", maxWorkers);
    }

    public int getMaxWorkers() {
        return pool.getMaximumPoolSize();
    }

    public TaskHandle submit(Runnable task) {
        Objects.requireNonNull(task, "task");
        return submit(() -> {
            task.run();
            return null;
        }, null, null, null);
    }

    public <T> TaskHandle submit(Callable<T> task, Consumer<? super T> onResult) {
        return submit(task, onResult, null, null);
    }

    public <T> TaskHandle submit(Callable<T> task, Consumer<? super T> onResult, Consumer<TaskError> onError) {
        return submit(task, onResult, onError, null);
    }

    /**
     * Queues a task.
     *
     * @param task       work to run on a worker thread
     * @param onResult   called with the return value on success (may be null)
     * @param onError    called with the failure on error (may be null)
     * @param onFinished called last, after either outcome (may be null)
     * @return handle that can discard interest in the callbacks
     */
    public <T> TaskHandle submit(Callable<T> task, Consumer<? super T> onResult,
                                 Consumer<TaskError> onError, Runnable onFinished) {
        Objects.requireNonNull(task, "task");
        QueuedTask<T> queued = new QueuedTask<>(new TaskHandle(ids.incrementAndGet()),
                task, onResult, onError, onFinished);
        incrementPending();
        try {
            pool.execute(queued);
        } catch (RejectedExecutionException e) {
            log.warn("Task {} rejected: executor is shut down", queued.handle.getId());
            queued.abandon(TaskError.of(e));
        }
        return queued.handle;
    }

    /**
     * Blocks until no task is queued or running.
     *
     * @param timeoutMs maximum wait in milliseconds; negative = no limit
     * @return true if the executor became idle in time
     */
    public boolean waitForIdle(long timeoutMs) {
        long deadline = timeoutMs >= 0 ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs) : Long.MAX_VALUE;
        idleLock.lock();
        try {
            while (pending > 0) {
                if (timeoutMs < 0) {
                    idle.await();
                } else {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    idle.awaitNanos(remaining);
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            idleLock.unlock();
        }
    }

    /** Tasks queued or running. */
    public int getPendingCount() {
        idleLock.lock();
        try {
            return pending;
        } finally {
            idleLock.unlock();
        }
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public void shutdown() {
        shutdown(DEFAULT_SHUTDOWN_WAIT);
    }

    /**
     * Stops accepting tasks and waits up to {@code wait} for queued ones to finish, then interrupts
     * whatever is still running.
     */
    public void shutdown(Duration wait) {
        if (pool.isShutdown()) return;
        log.info("Shutting down task executor ({} pending)", getPendingCount());
        pool.shutdown();
        try {
            if (!pool.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Task executor did not terminate within {} ms; interrupting workers", wait.toMillis());
                abandonQueued(pool.shutdownNow());
            }
        } catch (InterruptedException e) {
            abandonQueued(pool.shutdownNow());
            Thread.currentThread().interrupt();
        }
    }

    private void abandonQueued(List<Runnable> dropped) {
        if (dropped.isEmpty()) return;
        log.warn("Dropping {} queued tasks that never started", dropped.size());
        TaskError error = TaskError.of(new RejectedExecutionException("executor shut down before the task started"));
        for (Runnable r : dropped) {
            if (r instanceof QueuedTask<?> queued) {
                queued.abandon(error);
            }
        }
    }

    public boolean isShutdown() {
        return pool.isShutdown();
    }

    @Override
    public void onExit() {
        shutdown();
    }

    private <T> void run(TaskHandle handle, Callable<T> task, Consumer<? super T> onResult,
                         Consumer<TaskError> onError, Runnable onFinished) {
        long start = System.nanoTime();
        String outcome = "success";
        try {
            T result = null;
            TaskError error = null;
            try {
                result = task.call();
            } catch (Throwable e) {
                error = TaskError.of(e);
                outcome = "error";
                log.warn("Task {} failed: {}", handle.getId(), error.message());
            }
            if (handle.isCancelled()) {
                outcome = "cancelled";
            }
            deliverOutcome(handle, result, error, onResult, onError, onFinished);
        } finally {
            meterRegistry.timer(TIMER_NAME, "outcome", outcome).record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            handle.markDone();
            decrementPending();
        }
    }

    private <T> void deliverOutcome(TaskHandle handle, T result, TaskError error, Consumer<? super T> onResult,
                                    Consumer<TaskError> onError, Runnable onFinished) {
        if (handle.isCancelled()) {
            log.debug("Task {} cancelled; skipping callbacks", handle.getId());
            return;
        }
        try {
            if (error == null) {
                if (onResult != null) {
                    invokeCallback(handle, "onResult", () -> onResult.accept(result));
                }
            } else if (onError != null) {
                invokeCallback(handle, "onError", () -> onError.accept(error));
            }
        } finally {
            if (onFinished != null) {
                invokeCallback(handle, "onFinished", onFinished);
            }
        }
    }

    private static void invokeCallback(TaskHandle handle, String name, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Task {} {} callback failed: {}", handle.getId(), name, e.getMessage(), e);
        }
    }

    private void incrementPending() {
        idleLock.lock();
        try {
            pending++;
        } finally {
            idleLock.unlock();
        }
    }

    private void decrementPending() {
        idleLock.lock();
        try {
            pending--;
            if (pending == 0) {
                idle.signalAll();
            }
        } finally {
            idleLock.unlock();
        }
    }

    /** Queue entry; keeps the callbacks so a task dropped by {@code shutdownNow} can still be reported. */
    private final class QueuedTask<T> implements Runnable {
        final TaskHandle handle;
        private final Callable<T> task;
        private final Consumer<? super T> onResult;
        private final Consumer<TaskError> onError;
        private final Runnable onFinished;

        QueuedTask(TaskHandle handle, Callable<T> task, Consumer<? super T> onResult,
                   Consumer<TaskError> onError, Runnable onFinished) {
            this.handle = handle;
            this.task = task;
            this.onResult = onResult;
            this.onError = onError;
            this.onFinished = onFinished;
        }

        @Override
        public void run() {
            TaskExecutor.this.run(handle, task, onResult, onError, onFinished);
        }

        /** Reports a task that will never run. */
        void abandon(TaskError error) {
            try {
                deliverOutcome(handle, null, error, onResult, onError, onFinished);
            } finally {
                handle.markDone();
                decrementPending();
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "plughub-task-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
