package com.homeostat.core.port;

/**
 * The model backend could not be reached or did not answer in time. Retryable.
 */
public class ModelTransportException extends RuntimeException {

    public ModelTransportException(String message) {
        super(message);
    }

    public ModelTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
