package com.plughub.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * PlugHub host entry point. After bootstrap the main thread runs the event loop (owner-thread
 * event deliveries) until the JVM shuts down; the shutdown hook stops plugins and releases the host.
 */
public final class PlugHubApplication {

    private static final Logger log = LoggerFactory.getLogger(PlugHubApplication.class);

    private PlugHubApplication() {
    }

    public static void main(String[] args) {
        HostContext ctx = PlugHubBootstrap.initialize();
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down PlugHub...");
            try {
                ctx.shutdown();
            } finally {
                stopped.countDown();
            }
        }, "plughub-shutdown"));

        log.info("PlugHub running | plugins: {} | data: {} | server: {}",
                ctx.getPluginManager().getLoadedPluginIds(), ctx.getConfig().getDataDir(), ctx.getConfig().getServerUrl());
        ctx.getEventLoop().runUntil(stopped);
        if (!ctx.isShutdown()) {
            log.info("Event loop interrupted, shutting down PlugHub...");
            ctx.shutdown();
        }
    }
}
