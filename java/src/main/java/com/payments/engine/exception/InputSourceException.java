package com.payments.engine.exception;

/**
 * The input could not be opened or read. Unlike per-record failures this aborts the run.
 */
public class InputSourceException extends RuntimeException {

    public InputSourceException(String message) {
        super(message);
    }

    public InputSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
