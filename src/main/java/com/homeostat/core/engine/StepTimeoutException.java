package com.homeostat.core.engine;

import com.homeostat.core.model.TaskState;

import java.time.Duration;

/**
 * A step did not finish within its timeout, or the task ran out of budget.
 */
public class StepTimeoutException extends RuntimeException {

    private final TaskState state;

    public StepTimeoutException(TaskState state, Duration timeout) {
        super("Step " + state + " exceeded its timeout of " + timeout.toMillis() + "ms");
        this.state = state;
    }

    public StepTimeoutException(TaskState state, String message) {
        super(message);
        this.state = state;
    }

    public TaskState state() {
        return state;
    }
}
