package com.ogt.exposure.service;

import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.RasterGrid;
import com.ogt.exposure.model.ZonalStatistic;
import com.ogt.exposure.service.ZonalStatisticsService.ZonalResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ogt.exposure.TestLayers.UTM31N;
import static com.ogt.exposure.TestLayers.feature;
import static com.ogt.exposure.TestLayers.layer;
import static com.ogt.exposure.TestLayers.point;
import static com.ogt.exposure.TestLayers.square;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZonalStatisticsServiceTest {

    private final ZonalStatisticsService zonalService = new ZonalStatisticsService(new CoordinateService());

    /** 4 x 4 cells of 10 m, values 1..16 row by row from the top, lower-left corner at (0, 0). */
    static RasterGrid grid(Double nodata, double... values) {
        return RasterGrid.builder()
                .crs(UTM31N)
                .originX(0)
                .originY(40)
                .cellSize(10)
                .columns(4)
                .rows(4)
                .values(values)
                .nodata(nodata)
                .build();
    }

    static RasterGrid grid() {
        return grid(null, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16);
    }

    @Test
    void footprintUsesCellsWhoseCentreItCovers() {
        FeatureLayer buildings = layer("buildings", feature(1, square(0, 0, 20)));

        ZonalResult mean = zonalService.sample(buildings, grid(), ZonalStatistic.MEAN);
        ZonalResult max = zonalService.sample(buildings, grid(), ZonalStatistic.MAX);

        assertEquals(11.5, mean.getValues().get(1L), 1e-9);
        assertEquals(14.0, max.getValues().get(1L), 1e-9);
        assertTrue(mean.getCentroidFallback().isEmpty());
    }

    @Test
    void smallFootprintFallsBackToCentroidCell() {
        FeatureLayer buildings = layer("buildings", feature(1, square(21, 21, 2)));

        ZonalResult result = zonalService.sample(buildings, grid(), ZonalStatistic.MEAN);

        assertEquals(7.0, result.getValues().get(1L));
        assertEquals(List.of(1L), result.getCentroidFallback());
    }

    @Test
    void assetOutsideGridTakesNearestResolvedValue() {
        FeatureLayer assets = layer("assets",
                feature(1, square(0, 0, 20)),
                feature(2, square(21, 21, 2)),
                feature(3, point(100, 100)));

        ZonalResult result = zonalService.sample(assets, grid(), ZonalStatistic.MEAN);

        assertEquals(7.0, result.getValues().get(3L));
        assertEquals(List.of(3L), result.getNearestFallback());
        assertTrue(result.getUnresolved().isEmpty());
    }

    @Test
    void nodataCellsAreIgnored() {
        RasterGrid withGaps = grid(-9999.0, 1, 2, 3, 4, 5, 6, 7, 8, -9999, 10, 11, 12, 13, 14, 15, 16);
        FeatureLayer assets = layer("assets", feature(1, square(0, 0, 20)));

        ZonalResult result = zonalService.sample(assets, withGaps, ZonalStatistic.MIN);

        assertEquals(10.0, result.getValues().get(1L));
    }

    @Test
    void nothingResolvedLeavesNull() {
        FeatureLayer assets = layer("assets", feature(1, point(500, 500)));

        ZonalResult result = zonalService.sample(assets, grid(), ZonalStatistic.MEAN);

        assertNull(result.getValues().get(1L));
        assertEquals(List.of(1L), result.getUnresolved());
    }
}
