package com.homeostat.core.model;

import java.io.Serializable;

/**
 * Structured failure captured into a context when a task ends in {@link TaskState#FAILED}.
 *
 * @param type    simple name of the error type, e.g. {@code StepTimeoutException}
 * @param state   state the task was in when it failed
 * @param message detailed message; never shown to the requester
 */
public record TaskError(
        String type,
        TaskState state,
        String message
) implements Serializable {

    public static TaskError of(RuntimeException e, TaskState state) {
        return new TaskError(e.getClass().getSimpleName(), state, e.getMessage());
    }
}
