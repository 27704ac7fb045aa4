package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnitSystemTest {

    @Test
    void metresToFeetAndBack() {
        double feet = UnitSystem.METERS.convertTo(2.5, UnitSystem.FEET);

        assertEquals(8.2021, feet, 1e-4);
        assertEquals(2.5, UnitSystem.FEET.convertTo(feet, UnitSystem.METERS), 1e-6);
    }

    @Test
    void areaConvertsWithSquaredFactor() {
        assertEquals(10.7639, UnitSystem.METERS.convertAreaTo(1.0, UnitSystem.FEET), 1e-4);
        assertEquals(42.0, UnitSystem.FEET.convertAreaTo(42.0, UnitSystem.FEET));
    }

    @Test
    void parsesCommonSpellings() {
        assertEquals(UnitSystem.METERS, UnitSystem.fromString(" Metres "));
        assertEquals(UnitSystem.FEET, UnitSystem.fromString("ft"));
        assertThrows(UserInputException.class, () -> UnitSystem.fromString("yards"));
    }
}
