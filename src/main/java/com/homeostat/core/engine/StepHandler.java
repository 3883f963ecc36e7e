package com.homeostat.core.engine;

import com.homeostat.core.governance.Capability;
import com.homeostat.core.model.ExecutionContext;
import com.homeostat.core.model.TaskState;

import java.util.List;

/**
 * Logic for one non-terminal {@link TaskState}.
 * <p>
 * Handlers never modify the context they are given; they return a new one in the
 * {@link StepOutcome}. They may be interrupted when their step times out.
 */
public interface StepHandler {

    TaskState state();

    /**
     * Capabilities the step will use, checked by the executor before {@link #handle} runs.
     */
    default List<Capability> capabilities(ExecutionContext context) {
        return List.of();
    }

    StepOutcome handle(ExecutionContext context);

    default RetryPolicy retryPolicy() {
        return RetryPolicy.NONE;
    }
}
