package com.homeostat.core.port;

/**
 * Chat completion backend.
 */
public interface ModelPort {

    /**
     * @throws ModelTransportException when the backend times out or is unreachable
     */
    ModelResponse complete(ModelRequest request);
}
