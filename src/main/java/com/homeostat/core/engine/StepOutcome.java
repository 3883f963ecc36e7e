package com.homeostat.core.engine;

import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.TaskState;

import java.util.Objects;

/**
 * What a {@link StepHandler} produced: the updated context and the state to move to.
 */
public record StepOutcome(ExecutionContext context, TaskState next) {

    public StepOutcome {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(next, "next");
    }

    public static StepOutcome to(TaskState next, ExecutionContext context) {
        return new StepOutcome(context, next);
    }
}
