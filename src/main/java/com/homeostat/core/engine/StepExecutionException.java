package com.homeostat.core.engine;

import com.homeostat.core.model.TaskState;

/**
 * A step handler threw, or returned something unusable.
 */
public class StepExecutionException extends RuntimeException {

    private final TaskState state;

    public StepExecutionException(TaskState state, Throwable cause) {
        super("Step " + state + " failed: " + describe(cause), cause);
        this.state = state;
    }

    public StepExecutionException(TaskState state, String message) {
        super("Step " + state + " failed: " + message);
        this.state = state;
    }

    public TaskState state() {
        return state;
    }

    private static String describe(Throwable cause) {
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }
}
