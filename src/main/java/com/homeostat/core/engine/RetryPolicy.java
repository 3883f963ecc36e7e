package com.homeostat.core.engine;

import com.homeostat.core.port.ModelTransportException;

/**
 * How a failed step attempt is treated. Attempt count and backoff come from
 * {@code homeostat.executor.retry-attempts} and {@code retry-backoff}.
 */
public enum RetryPolicy {

    /** Every failure ends the task. */
    NONE {
        @Override
        public boolean isRetryable(Throwable failure) {
            return false;
        }
    },

    /** Model transport failures are retried with a fixed backoff. */
    TRANSIENT {
        @Override
        public boolean isRetryable(Throwable failure) {
            return failure instanceof ModelTransportException;
        }
    };

    public abstract boolean isRetryable(Throwable failure);
}
