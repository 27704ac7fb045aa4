package com.ogt.exposure.exception;

/**
 * Base class of every error raised while building an exposure table.
 */
public class ExposureException extends RuntimeException {

    public ExposureException(String message) {
        super(message);
    }

    public ExposureException(String message, Throwable cause) {
        super(message, cause);
    }
}
