package com.homeostat.core.approval;

/**
 * Thrown when nobody decided on an approval request before it expired.
 */
public class ApprovalTimeoutException extends RuntimeException {

    public ApprovalTimeoutException(String message) {
        super(message);
    }
}
