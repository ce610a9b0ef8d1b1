package com.plughub.manager;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of a batch (load all, stop all, builtin scan): ids that succeeded plus one
 * failed {@link OperationResult} per id that did not.
 */
public final class BatchResult {

    private final List<String> succeeded;
    private final Map<String, OperationResult> failures;

    private BatchResult(List<String> succeeded, Map<String, OperationResult> failures) {
        this.succeeded = List.copyOf(succeeded);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /** True when no id failed. */
    public boolean isSuccess() {
        return failures.isEmpty();
    }

    /** Ids in processing order. */
    public List<String> getSucceeded() {
        return succeeded;
    }

    public Map<String, OperationResult> getFailures() {
        return failures;
    }

    static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "BatchResult{succeeded=" + succeeded + ", failed=" + failures.keySet() + "}";
    }

    static final class Builder {
        private final List<String> succeeded = new ArrayList<>();
        private final Map<String, OperationResult> failures = new LinkedHashMap<>();

        Builder add(String id, OperationResult result) {
            if (result.isSuccess()) {
                succeeded.add(id);
            } else {
                failures.put(id, result);
            }
            return this;
        }

        BatchResult build() {
            return new BatchResult(succeeded, failures);
        }
    }
}
