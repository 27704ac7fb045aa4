package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;

import java.util.Locale;

public enum JoinMethod {
    NEAREST,
    INTERSECTION;

    public static JoinMethod fromString(String value) {
        if (value == null) {
            throw new UserInputException("Join method cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "nearest" -> NEAREST;
            case "intersection", "intersects" -> INTERSECTION;
            default -> throw new UserInputException("Unknown join method: " + value + ". Use 'nearest' or 'intersection'.");
        };
    }
}
