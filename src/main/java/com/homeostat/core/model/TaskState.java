package com.homeostat.core.model;

/**
 * Execution phases of a single task.
 * <p>
 * {@link #COMPLETED} and {@link #FAILED} are terminal: the executor never
 * leaves them once entered.
 */
public enum TaskState {
    INIT,
    PLANNING,
    MODEL_CALL,
    TOOL_EXECUTION,
    SYNTHESIS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
