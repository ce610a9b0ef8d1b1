package com.plughub.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link OwnerThreadDispatcher} bound to one thread that pumps its own queue.
 * The owner calls {@link #runPending()} between units of work, or parks in
 * {@link #runUntil(CountDownLatch)} when it has nothing else to do (the host main thread does this).
 */
public final class EventLoop implements OwnerThreadDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);
    private static final long POLL_MILLIS = 100;

    private final Thread owner;
    private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();

    private EventLoop(Thread owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    /** Creates a loop owned by the calling thread. */
    public static EventLoop forCurrentThread() {
        return new EventLoop(Thread.currentThread());
    }

    public Thread getOwner() {
        return owner;
    }

    @Override
    public boolean isOwnerThread() {
        return Thread.currentThread() == owner;
    }

    @Override
    public void dispatch(Runnable task) {
        tasks.add(Objects.requireNonNull(task, "task"));
    }

    /** Number of tasks waiting for the owner thread. */
    public int pendingCount() {
        return tasks.size();
    }

    /**
     * Runs every task queued at call time plus any they enqueue, on the calling thread.
     *
     * @return number of tasks run
     * @throws IllegalStateException if called from a thread other than the owner
     */
    public int runPending() {
        checkOwner();
        int n = 0;
        Runnable task;
        while ((task = tasks.poll()) != null) {
            runSafely(task);
            n++;
        }
        return n;
    }

    /**
     * Pumps the queue until {@code stopSignal} reaches zero, then drains what is left.
     * Returns early if the owner thread is interrupted (interrupt flag is restored).
     */
    public void runUntil(CountDownLatch stopSignal) {
        checkOwner();
        try {
            while (stopSignal.getCount() > 0) {
                Runnable task = tasks.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (task != null) {
                    runSafely(task);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Event loop interrupted on {}", owner.getName());
        }
        runPending();
    }

    /**
     * Waits up to {@code timeout} for at least one task, then runs everything pending.
     *
     * @return number of tasks run
     */
    public int runPending(Duration timeout) throws InterruptedException {
        checkOwner();
        Runnable first = tasks.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) {
            return 0;
        }
        runSafely(first);
        return 1 + runPending();
    }

    private void checkOwner() {
        if (!isOwnerThread()) {
            throw new IllegalStateException("Event loop is owned by " + owner.getName()
                    + ", not " + Thread.currentThread().getName());
        }
    }

    private static void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Owner-thread task failed: {}", e.getMessage(), e);
        }
    }
}
