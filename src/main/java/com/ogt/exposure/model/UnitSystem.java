package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;

import java.util.Locale;

/**
 * Length unit used for every derived value of an exposure model.
 */
public enum UnitSystem {
    METERS,
    FEET;

    public static final double FEET_PER_METER = 3.28084;
    public static final double METERS_PER_FOOT = 0.3048;

    public double convertTo(double value, UnitSystem target) {
        if (this == target) {
            return value;
        }
        return this == METERS ? value * FEET_PER_METER : value / FEET_PER_METER;
    }

    public double convertAreaTo(double value, UnitSystem target) {
        return convertTo(convertTo(value, target), target);
    }

    public static UnitSystem fromString(String value) {
        if (value == null) {
            throw new UserInputException("Unit cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "m", "meter", "meters", "metre", "metres" -> METERS;
            case "ft", "foot", "feet" -> FEET;
            default -> throw new UserInputException("Unknown unit: " + value + ". Use 'meters' or 'feet'.");
        };
    }
}
