package com.plughub.manager;

import com.plughub.tasks.TaskError;
import com.plughub.tasks.TaskExecutor;
import com.plughub.tasks.TaskHandle;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * Runs the long {@link PluginManager} operations on a {@link TaskExecutor} worker. The callback
 * receives the operation's result on the worker thread; a task that dies before producing one is
 * reported as a failed result. A cancelled handle skips the callback.
 */
public final class AsyncPluginOperations {

    private final PluginManager manager;
    private final TaskExecutor executor;

    public AsyncPluginOperations(PluginManager manager, TaskExecutor executor) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public TaskHandle installAsync(Path packagePath, boolean enable, boolean force, Consumer<OperationResult> callback) {
        return run(null, PluginErrorKind.INSTALL, () -> manager.installFromPackage(packagePath, enable, force), callback);
    }

    public TaskHandle installFromRemoteAsync(String pluginId, boolean enable, Consumer<OperationResult> callback) {
        return run(pluginId, PluginErrorKind.INSTALL, () -> manager.installFromRemote(pluginId, enable), callback);
    }

    public TaskHandle updateAsync(String pluginId, Path newPackagePath, boolean autoRestart,
                                  Consumer<OperationResult> callback) {
        return run(pluginId, PluginErrorKind.INSTALL, () -> manager.update(pluginId, newPackagePath, autoRestart), callback);
    }

    public TaskHandle uninstallAsync(String pluginId, boolean removeData, Consumer<OperationResult> callback) {
        return run(pluginId, PluginErrorKind.INSTALL, () -> manager.uninstall(pluginId, removeData), callback);
    }

    public TaskHandle processAsync(String pluginId, Map<String, Object> input, Consumer<OperationResult> callback) {
        return run(pluginId, PluginErrorKind.PROCESS, () -> manager.process(pluginId, input), callback);
    }

    private TaskHandle run(String pluginId, PluginErrorKind failureKind, Callable<OperationResult> operation,
                           Consumer<OperationResult> callback) {
        Consumer<OperationResult> sink = callback != null ? callback : r -> { };
        return executor.submit(operation, sink,
                (TaskError error) -> sink.accept(OperationResult.failure(pluginId, failureKind, error.message())));
    }
}
