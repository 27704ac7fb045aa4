package com.ogt.exposure.exception;

public class DamageTableRequiredException extends UserInputException {

    public DamageTableRequiredException(String catalog) {
        super("A damage cost table is required for catalog '" + catalog + "' but none was provided");
    }
}
