package com.ogt.exposure.service;

import com.ogt.exposure.model.DamageCurveSet;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FloodproofingServiceTest {

    private final FloodproofingService floodproofingService = new FloodproofingService();

    private final DamageCurveSet curves = DamageCurveSet.withDepths(0, 0.5, 1, 2, 3)
            .withCurve("AS1", new double[]{0, 0.2, 0.4, 0.7, 1.0})
            .withCurve("AS2", new double[]{0, 0.1, 0.3, 0.5, 0.8});

    private Exposure exposure() {
        ExposureTable table = ExposureTable.fromRows(List.of(
                Map.of("object_id", 1L, "fn_damage_structure", "AS1"),
                Map.of("object_id", 2L, "fn_damage_structure", "AS1"),
                Map.of("object_id", 3L, "fn_damage_structure", "AS2"),
                Map.of("object_id", 4L, "fn_damage_structure", "UNKNOWN")));
        return Exposure.of(table, null).withCurves(curves);
    }

    @Test
    void selectedAssetsGetTruncatedVariant() {
        Exposure result = floodproofingService.floodproof(exposure(), List.of(1L, 3L), 1.0, List.of("structure"));

        assertEquals("AS1_fp_1", result.getTable().getString(1L, "fn_damage_structure"));
        assertEquals("AS1", result.getTable().getString(2L, "fn_damage_structure"));
        assertEquals("AS2_fp_1", result.getTable().getString(3L, "fn_damage_structure"));
        assertArrayEquals(new double[]{0, 0, 0.4, 0.7, 1.0}, result.getCurves().getFractions("AS1_fp_1"), 1e-12);
        assertArrayEquals(new double[]{0, 0.2, 0.4, 0.7, 1.0}, result.getCurves().getFractions("AS1"), 1e-12);
    }

    @Test
    void existingVariantIsReused() {
        Exposure once = floodproofingService.floodproof(exposure(), List.of(1L), 1.5, List.of("structure"));
        Exposure twice = floodproofingService.floodproof(once, List.of(2L), 1.5, List.of("structure"));

        assertEquals("AS1_fp_1_5", twice.getTable().getString(2L, "fn_damage_structure"));
        assertEquals(3, twice.getCurves().size());
    }

    @Test
    void unknownCurveIsReportedAndLeftUnchanged() {
        Exposure result = floodproofingService.floodproof(exposure(), List.of(4L), 1.0, List.of("structure"));

        assertEquals("UNKNOWN", result.getTable().getString(4L, "fn_damage_structure"));
        assertEquals(1, result.getQualityLog().countOf("UNKNOWN_DAMAGE_FUNCTION"));
    }

    @Test
    void nullSelectionFloodproofsEveryAsset() {
        Exposure result = floodproofingService.floodproof(exposure(), null, 1.0, List.of("structure"));

        assertEquals("AS1_fp_1", result.getTable().getString(2L, "fn_damage_structure"));
        assertEquals("AS2_fp_1", result.getTable().getString(3L, "fn_damage_structure"));
        assertEquals("UNKNOWN", result.getTable().getString(4L, "fn_damage_structure"));
    }

    @Test
    void idsOutsideTheModelAreReported() {
        Exposure result = floodproofingService.floodproof(exposure(), List.of(1L, 99L), 1.0, List.of("structure"));

        assertEquals("AS1_fp_1", result.getTable().getString(1L, "fn_damage_structure"));
        assertEquals(1, result.getQualityLog().countOf("UNKNOWN_OBJECT_ID"));
    }

    @Test
    void suffixDropsTrailingZeros() {
        assertEquals("_fp_2", FloodproofingService.suffix(2.0));
        assertEquals("_fp_1_5", FloodproofingService.suffix(1.50));
    }

    @Test
    void curvesAreRequired() {
        Exposure withoutCurves = exposure().withCurves(null);

        assertThrows(IllegalStateException.class,
                () -> floodproofingService.floodproof(withoutCurves, List.of(1L), 1.0, List.of("structure")));
        assertTrue(exposure().getCurves().contains("AS2"));
    }
}
