package com.neuralroots.common.exception;

/**
 * Thrown by a {@code DataStore} that cannot answer at all. An empty answer is not an error.
 */
public class DataStoreUnavailableException extends RuntimeException {

    public DataStoreUnavailableException(String message) {
        super(message);
    }

    public DataStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
