package com.homeostat.core.sensor;

/**
 * Thrown when a single metric collector cannot produce a reading. The sampler
 * omits that metric for the cycle and keeps going.
 */
public class CollectionException extends RuntimeException {

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
