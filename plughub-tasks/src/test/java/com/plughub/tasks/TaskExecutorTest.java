package com.plughub.tasks;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskExecutorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TaskExecutor executor = new TaskExecutor(2, registry);

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void submit_successCallsOnResultThenOnFinished() {
        List<String> calls = new CopyOnWriteArrayList<>();

        executor.submit(() -> 42,
                r -> calls.add("result:" + r),
                e -> calls.add("error"),
                () -> calls.add("finished"));

        assertTrue(executor.waitForIdle(5_000));
        assertEquals(List.of("result:42", "finished"), calls);
    }

    @Test
    void submit_failingTaskCallsOnErrorThenOnFinishedExactlyOnce() {
        List<String> calls = new CopyOnWriteArrayList<>();
        AtomicReference<TaskError> error = new AtomicReference<>();

        executor.submit(() -> {
                    throw new IllegalStateException("download failed");
                },
                r -> calls.add("result"),
                e -> {
                    calls.add("error");
                    error.set(e);
                },
                () -> calls.add("finished"));

        assertTrue(executor.waitForIdle(5_000));
        assertEquals(List.of("error", "finished"), calls);
        assertEquals("IllegalStateException: download failed", error.get().message());
        assertTrue(error.get().detail().contains("TaskExecutorTest"));
        assertEquals(1L, registry.get(TaskExecutor.TIMER_NAME).tag("outcome", "error").timer().count());
    }

    @Test
    void submit_throwingCallbackStillRunsOnFinishedAndKeepsPoolAlive() {
        AtomicInteger finished = new AtomicInteger();

        executor.submit(() -> "x", r -> {
            throw new RuntimeException("callback bug");
        }, null, finished::incrementAndGet);
        executor.submit(() -> "y", null, null, finished::incrementAndGet);

        assertTrue(executor.waitForIdle(5_000));
        assertEquals(2, finished.get());
    }

    @Test
    void waitForIdle_falseWhileTaskSleepsThenTrue() {
        executor.submit(() -> {
            Thread.sleep(400);
            return null;
        }, null);

        assertFalse(executor.waitForIdle(50));
        assertTrue(executor.waitForIdle(5_000));
        assertEquals(0, executor.getPendingCount());
    }

    @Test
    void cancel_queuedTaskStillRunsButSkipsCallbacks() throws Exception {
        executor.configure(1);
        CountDownLatch block = new CountDownLatch(1);
        AtomicBoolean workRan = new AtomicBoolean();
        List<String> calls = new CopyOnWriteArrayList<>();

        executor.submit(() -> block.await(5, TimeUnit.SECONDS), null);
        TaskHandle queued = executor.submit(() -> {
            workRan.set(true);
            return "late";
        }, r -> calls.add("result"), e -> calls.add("error"), () -> calls.add("finished"));

        assertTrue(queued.cancel());
        block.countDown();
        assertTrue(executor.waitForIdle(5_000));

        assertTrue(workRan.get());
        assertTrue(queued.isDone());
        assertTrue(calls.isEmpty());
        assertFalse(queued.cancel());
        assertEquals(1L, registry.get(TaskExecutor.TIMER_NAME).tag("outcome", "cancelled").timer().count());
    }

    @Test
    void configure_rejectsNonPositiveAndResizes() {
        assertThrows(IllegalArgumentException.class, () -> executor.configure(0));
        executor.configure(4);
        assertEquals(4, executor.getMaxWorkers());
        executor.configure(1);
        assertEquals(1, executor.getMaxWorkers());
    }

    @Test
    void submit_afterShutdownReportsErrorThroughCallbacks() {
        executor.shutdown();
        AtomicReference<TaskError> error = new AtomicReference<>();
        AtomicInteger finished = new AtomicInteger();

        TaskHandle handle = executor.submit(() -> 1, null, error::set, finished::incrementAndGet);

        assertNotNull(error.get());
        assertEquals(1, finished.get());
        assertTrue(handle.isDone());
        assertTrue(executor.waitForIdle(0));
    }

    @Test
    void shutdown_reportsQueuedTasksDroppedAfterTimeout() {
        executor.configure(1);
        CountDownLatch started = new CountDownLatch(1);
        List<String> calls = new CopyOnWriteArrayList<>();

        executor.submit(() -> {
            started.countDown();
            Thread.sleep(2_000);
            return "slow";
        }, r -> calls.add("slow:result"), e -> calls.add("slow:error"), () -> calls.add("slow:finished"));
        executor.submit(() -> "never", r -> calls.add("queued:result"), e -> calls.add("queued:error"),
                () -> calls.add("queued:finished"));
        assertDoesNotThrow(() -> started.await(5, TimeUnit.SECONDS));

        executor.shutdown(Duration.ofMillis(100));

        assertTrue(executor.waitForIdle(5_000));
        assertEquals(0, executor.getPendingCount());
        assertTrue(calls.containsAll(List.of("queued:error", "queued:finished", "slow:error", "slow:finished")),
                calls.toString());
        assertEquals(4, calls.size(), calls.toString());
    }

    @Test
    void submit_stackOverflowIsReportedAsError() {
        AtomicReference<TaskError> error = new AtomicReference<>();
        AtomicInteger finished = new AtomicInteger();

        executor.submit(TaskExecutorTest::recurse, null, error::set, finished::incrementAndGet);

        assertTrue(executor.waitForIdle(5_000));
        assertTrue(error.get().message().startsWith("StackOverflowError"), error.get().message());
        assertEquals(1, finished.get());
    }

    private static Integer recurse() {
        return recurse() + 1;
    }
}
