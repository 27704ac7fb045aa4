package com.ogt.exposure.exception;

public class MalformedTableException extends UserInputException {

    public MalformedTableException(String message) {
        super(message);
    }

    public MalformedTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
