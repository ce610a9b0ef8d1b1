package com.plughub.events;

/**
 * Target for deferred delivery: the single thread that owns affinity-bound work
 * (for a desktop host, its UI thread). {@link EventBus#publish(String, Object, boolean)} hands
 * listeners to {@link #dispatch(Runnable)} when called off that thread.
 */
public interface OwnerThreadDispatcher {

    /** Whether the calling thread is the owner thread. */
    boolean isOwnerThread();

    /**
     * Schedules the task to run on the owner thread. Tasks dispatched from one thread run in
     * dispatch order; they interleave with any other work the owner thread does.
     */
    void dispatch(Runnable task);
}
