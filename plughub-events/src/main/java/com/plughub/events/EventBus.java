package com.plughub.events;

import com.plughub.annotations.ResourceCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Publish/subscribe bus decoupling plugin lifecycle transitions from their observers.
 * <p>
 * Delivery modes:
 * <ul>
 *   <li>{@link #publish(String, Object)}: synchronous on the calling thread, to a snapshot of the
 *   subscribers taken under the lock; the lock is released before listeners run, so a listener may
 *   subscribe, unsubscribe or publish without deadlocking.</li>
 *   <li>{@link #publish(String, Object, boolean)} with {@code deliverOnOwnerThread}: when the caller is
 *   not the owner thread each listener is handed to the {@link OwnerThreadDispatcher} instead.</li>
 *   <li>{@link #publishAsync(String, Object)}: queued (unbounded, FIFO) and delivered by one dedicated
 *   worker thread. Async events keep their relative order; they are not ordered against
 *   synchronous ones.</li>
 * </ul>
 * After {@link #shutdown()} every publish call is a silent no-op.
 */
public final class EventBus implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final Duration DEFAULT_SHUTDOWN_WAIT = Duration.ofSeconds(2);
    private static final AsyncEvent STOP = new AsyncEvent("", null, false);

    private final Object subscribersLock = new Object();
    /** eventType → subscriptions in subscription order */
    private final Map<String, List<Subscription>> subscribers = new HashMap<>();

    private final OwnerThreadDispatcher ownerThread;
    private final Duration shutdownWait;

    private final BlockingQueue<AsyncEvent> asyncQueue = new LinkedBlockingQueue<>();
    private final Thread asyncWorker;
    private final ReentrantLock drainLock = new ReentrantLock();
    private final Condition drained = drainLock.newCondition();
    private long enqueued;
    private long processed;
    private volatile boolean accepting = true;
    private volatile boolean workerStopped;

    /** Bus without an owner thread: owner-thread delivery falls back to the calling thread. */
    public EventBus() {
        this(null, DEFAULT_SHUTDOWN_WAIT);
    }

    public EventBus(OwnerThreadDispatcher ownerThread) {
        this(ownerThread, DEFAULT_SHUTDOWN_WAIT);
    }

    /**
     * @param ownerThread  target for deferred delivery; null = deliver on the calling thread
     * @param shutdownWait how long {@link #shutdown()} waits for the async worker to finish queued events
     */
    public EventBus(OwnerThreadDispatcher ownerThread, Duration shutdownWait) {
        this.ownerThread = ownerThread;
        this.shutdownWait = shutdownWait != null ? shutdownWait : DEFAULT_SHUTDOWN_WAIT;
        this.asyncWorker = new Thread(this::drainAsyncQueue, "plughub-event-async");
        this.asyncWorker.setDaemon(true);
        this.asyncWorker.start();
        log.debug("Event bus started (ownerThread={})", ownerThread != null ? "set" : "none");
    }

    /**
     * Registers a listener under a generated subscriber id.
     *
     * @return subscriber id; pass it to {@link #unsubscribe(String, String)}
     */
    public String subscribe(String eventType, EventListener listener) {
        return subscribe(eventType, listener, null);
    }

    /**
     * Registers a listener under the given subscriber id (null or blank = generated UUID).
     *
     * @throws IllegalArgumentException if the id is already subscribed to this event type
     */
    public String subscribe(String eventType, EventListener listener, String subscriberId) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(listener, "listener");
        String id = subscriberId != null && !subscriberId.isBlank() ? subscriberId.trim() : UUID.randomUUID().toString();
        synchronized (subscribersLock) {
            List<Subscription> list = subscribers.computeIfAbsent(eventType, k -> new ArrayList<>());
            for (Subscription s : list) {
                if (s.subscriberId().equals(id)) {
                    throw new IllegalArgumentException("Subscriber " + id + " already subscribed to " + eventType);
                }
            }
            list.add(new Subscription(eventType, id, listener));
        }
        log.debug("Subscribed {} to {}", id, eventType);
        return id;
    }

    /**
     * Removes a subscription.
     *
     * @return true if it existed; false otherwise (not an error)
     */
    public boolean unsubscribe(String eventType, String subscriberId) {
        if (eventType == null || subscriberId == null) return false;
        boolean removed;
        synchronized (subscribersLock) {
            List<Subscription> list = subscribers.get(eventType);
            if (list == null) return false;
            removed = list.removeIf(s -> s.subscriberId().equals(subscriberId));
            if (list.isEmpty()) {
                subscribers.remove(eventType);
            }
        }
        if (removed) {
            log.debug("Unsubscribed {} from {}", subscriberId, eventType);
        } else {
            log.debug("No subscription {} on {}", subscriberId, eventType);
        }
        return removed;
    }

    /** Number of current subscriptions for the event type. */
    public int subscriberCount(String eventType) {
        synchronized (subscribersLock) {
            List<Subscription> list = subscribers.get(eventType);
            return list != null ? list.size() : 0;
        }
    }

    /**
     * Delivers the event synchronously on the calling thread.
     *
     * @return number of listeners invoked
     */
    public int publish(String eventType, Object payload) {
        return publish(eventType, payload, false);
    }

    /**
     * Delivers the event to a snapshot of the current subscribers. With {@code deliverOnOwnerThread}
     * and a caller that is not the owner thread, each listener is scheduled on the owner thread in
     * subscription order and this method returns without waiting for them.
     *
     * @return number of listeners invoked or scheduled; 0 after shutdown
     */
    public int publish(String eventType, Object payload, boolean deliverOnOwnerThread) {
        if (!accepting) {
            log.debug("Event bus shut down; dropping {}", eventType);
            return 0;
        }
        return deliver(eventType, payload, deliverOnOwnerThread);
    }

    /** Queues the event for delivery by the async worker. No-op after shutdown. */
    public void publishAsync(String eventType, Object payload) {
        publishAsync(eventType, payload, false);
    }

    /** Queues the event for delivery by the async worker, optionally re-dispatched to the owner thread. */
    public void publishAsync(String eventType, Object payload, boolean deliverOnOwnerThread) {
        Objects.requireNonNull(eventType, "eventType");
        drainLock.lock();
        try {
            if (!accepting) {
                log.debug("Event bus shut down; dropping async {}", eventType);
                return;
            }
            enqueued++;
            asyncQueue.add(new AsyncEvent(eventType, payload, deliverOnOwnerThread));
        } finally {
            drainLock.unlock();
        }
    }

    /**
     * Blocks until every async event queued before this call has been delivered.
     * Returns immediately when called from the async worker itself (a listener) or after shutdown.
     */
    public void flush() {
        flush(null);
    }

    /**
     * Like {@link #flush()} with an upper bound.
     *
     * @param timeout maximum wait; null = no limit
     * @return true if the queue was drained up to the call point
     */
    public boolean flush(Duration timeout) {
        if (Thread.currentThread() == asyncWorker) {
            log.warn("flush() called from an async listener; returning without waiting");
            return false;
        }
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : Long.MAX_VALUE;
        drainLock.lock();
        try {
            long target = enqueued;
            while (processed < target) {
                if (workerStopped) {
                    return false;
                }
                if (timeout == null) {
                    drained.await(200, TimeUnit.MILLISECONDS);
                } else {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    drained.awaitNanos(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(200)));
                }
            }
            log.debug("Async event queue drained ({} events)", target);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            drainLock.unlock();
        }
    }

    /**
     * Stops accepting events, lets the worker deliver what is already queued within the configured
     * wait, then clears all subscriptions. Idempotent.
     */
    public void shutdown() {
        drainLock.lock();
        try {
            if (!accepting) return;
            accepting = false;
            asyncQueue.add(STOP);
        } finally {
            drainLock.unlock();
        }
        log.info("Shutting down event bus");
        try {
            asyncWorker.join(shutdownWait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (asyncWorker.isAlive()) {
            log.warn("Async event worker did not finish within {} ms; interrupting ({} events pending)",
                    shutdownWait.toMillis(), asyncQueue.size());
            asyncWorker.interrupt();
        }
        synchronized (subscribersLock) {
            subscribers.clear();
        }
        log.info("Event bus shut down");
    }

    public boolean isShutdown() {
        return !accepting;
    }

    @Override
    public void onExit() {
        shutdown();
    }

    private int deliver(String eventType, Object payload, boolean deliverOnOwnerThread) {
        List<Subscription> snapshot;
        synchronized (subscribersLock) {
            List<Subscription> list = subscribers.get(eventType);
            if (list == null || list.isEmpty()) {
                return 0;
            }
            snapshot = List.copyOf(list);
        }
        Event event = new Event(eventType, payload);
        boolean defer = deliverOnOwnerThread && ownerThread != null && !ownerThread.isOwnerThread();
        for (Subscription s : snapshot) {
            if (defer) {
                ownerThread.dispatch(() -> invoke(s, event));
            } else {
                invoke(s, event);
            }
        }
        return snapshot.size();
    }

    private static void invoke(Subscription s, Event event) {
        try {
            s.listener().onEvent(event);
        } catch (Exception e) {
            log.error("Event listener failed (eventType={}, subscriberId={}): {}",
                    s.eventType(), s.subscriberId(), e.getMessage(), e);
        }
    }

    private void drainAsyncQueue() {
        log.debug("Async event worker started");
        try {
            while (true) {
                AsyncEvent item = asyncQueue.take();
                if (item == STOP) {
                    break;
                }
                try {
                    deliver(item.eventType(), item.payload(), item.deliverOnOwnerThread());
                } catch (RuntimeException e) {
                    log.error("Async delivery of {} failed: {}", item.eventType(), e.getMessage(), e);
                } finally {
                    markProcessed();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            drainLock.lock();
            try {
                workerStopped = true;
                drained.signalAll();
            } finally {
                drainLock.unlock();
            }
            log.debug("Async event worker stopped");
        }
    }

    private void markProcessed() {
        drainLock.lock();
        try {
            processed++;
            drained.signalAll();
        } finally {
            drainLock.unlock();
        }
    }

    private record AsyncEvent(String eventType, Object payload, boolean deliverOnOwnerThread) {
    }
}
