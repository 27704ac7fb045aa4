package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;

import java.util.Locale;

/**
 * How the hazard depth is sampled for an asset.
 */
public enum ExtractionMethod {
    CENTROID("centroid"),
    AREA("area");

    private final String code;

    ExtractionMethod(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ExtractionMethod fromString(String value) {
        if (value == null) {
            throw new UserInputException("Extraction method cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "centroid" -> CENTROID;
            case "area" -> AREA;
            default -> throw new UserInputException("Unknown extraction method: " + value);
        };
    }
}
