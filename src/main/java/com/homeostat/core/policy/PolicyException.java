package com.homeostat.core.policy;

/**
 * Thrown when the governance policy is missing or malformed. Raised while the
 * application context starts, so the process refuses to run with an undefined mode.
 */
public class PolicyException extends RuntimeException {

    public PolicyException(String message) {
        super(message);
    }

    public PolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
