package com.plughub.tasks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a submitted task. {@link #cancel()} discards interest in the callbacks; it does not
 * interrupt work that is already running.
 */
public final class TaskHandle {

    private final long id;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile boolean done;

    TaskHandle(long id) {
        this.id = id;
    }

    public long getId() {
        return id;
    }

    /**
     * Suppresses every callback that has not started yet.
     *
     * @return true if this call cancelled the handle, false if it was already cancelled or done
     */
    public boolean cancel() {
        return !done && cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return done;
    }

    void markDone() {
        done = true;
    }

    @Override
    public String toString() {
        return "TaskHandle{id=" + id + ", cancelled=" + cancelled.get() + ", done=" + done + "}";
    }
}
