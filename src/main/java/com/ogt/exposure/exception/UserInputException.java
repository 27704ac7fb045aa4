package com.ogt.exposure.exception;

/**
 * Invalid arguments or data supplied by the caller. Not recoverable at this layer.
 */
public class UserInputException extends ExposureException {

    public UserInputException(String message) {
        super(message);
    }

    public UserInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
