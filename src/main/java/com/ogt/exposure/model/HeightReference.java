package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;

import java.util.Locale;

/**
 * What a required floor level is measured against.
 * DATUM: absolute level. GEOM: attribute of a reference layer. TABLE: per object_id table.
 */
public enum HeightReference {
    DATUM,
    GEOM,
    TABLE;

    public static HeightReference fromString(String value) {
        if (value == null) {
            throw new UserInputException("Height reference cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "datum" -> DATUM;
            case "geom" -> GEOM;
            case "table" -> TABLE;
            default -> throw new UserInputException("Height reference '" + value
                    + "' is not allowed. Use 'datum', 'geom' or 'table'.");
        };
    }
}
