package com.ogt.exposure.exception;

import com.ogt.exposure.model.JoinMethod;

public class JoinMethodUnsupportedException extends UserInputException {

    public JoinMethodUnsupportedException(JoinMethod method, String primaryType, String referenceType) {
        super(String.format("Join method %s is not supported between %s and %s geometries",
                method, primaryType, referenceType));
    }
}
