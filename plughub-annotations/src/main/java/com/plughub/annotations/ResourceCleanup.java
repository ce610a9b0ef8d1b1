package com.plughub.annotations;

/**
 * Contract for releasing resources when the host is shutting down.
 * Components that own threads, class loaders or open files (event bus, task executor,
 * plugin manager) implement this; the host invokes {@link #onExit()} on each of them once,
 * in reverse order of creation, before the process exits.
 */
public interface ResourceCleanup {

    /**
     * Called once when the host is shutting down. Implementations release what they own
     * (stop workers, close loaders, drain queues). Exceptions should be logged and not rethrown
     * so the remaining components still get a chance to clean up.
     */
    void onExit();
}
