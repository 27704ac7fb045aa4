package com.ogt.exposure.service;

import com.ogt.exposure.exception.UserInputException;
import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.io.RasterProvider;
import com.ogt.exposure.io.TabularDataProvider;
import com.ogt.exposure.model.DataTable;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.HeightReference;
import com.ogt.exposure.model.HeightSource;
import com.ogt.exposure.model.JoinMethod;
import com.ogt.exposure.model.LayerJoin;
import com.ogt.exposure.model.RaiseRequest;
import com.ogt.exposure.model.Region;
import com.ogt.exposure.model.UnitSystem;
import com.ogt.exposure.model.ZonalStatistic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.exposure.TestLayers.UTM31N;
import static com.ogt.exposure.TestLayers.exposure;
import static com.ogt.exposure.TestLayers.feature;
import static com.ogt.exposure.TestLayers.layer;
import static com.ogt.exposure.TestLayers.point;
import static com.ogt.exposure.TestLayers.properties;
import static com.ogt.exposure.TestLayers.square;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HeightElevationServiceTest {

    private GeometrySourceProvider geometryProvider;
    private TabularDataProvider tabularProvider;
    private RasterProvider rasterProvider;
    private HeightElevationService heightService;

    private final FeatureLayer buildings = layer("buildings",
            feature(1, square(0, 0, 20)),
            feature(2, square(21, 21, 2)));

    @BeforeEach
    void setUp() {
        geometryProvider = mock(GeometrySourceProvider.class);
        tabularProvider = mock(TabularDataProvider.class);
        rasterProvider = mock(RasterProvider.class);
        CoordinateService coordinateService = new CoordinateService();
        heightService = new HeightElevationService(properties(), new SpatialJoinService(coordinateService),
                new AttributeMerger(), new ZonalStatisticsService(coordinateService),
                geometryProvider, tabularProvider, rasterProvider);
    }

    @Test
    void constantAndDefaultSources() {
        Exposure withHeight = heightService.setGroundFloorHeight(exposure(buildings), HeightSource.constant(0.5));
        Exposure withElevation = heightService.setGroundElevation(withHeight, HeightSource.defaultZero());

        assertEquals(0.5, withElevation.getTable().getDouble(2L, "ground_flht"));
        assertEquals(0.0, withElevation.getTable().getDouble(2L, "ground_elevtn"));
    }

    @Test
    void fileValuesAreConvertedToModelUnit() {
        when(geometryProvider.read(eq("heights.geojson"), any(Region.class))).thenReturn(layer("heights",
                feature(1, point(10, 10), "ffh", 10.0),
                feature(2, point(22, 22), "ffh", "5")));
        LayerJoin join = LayerJoin.builder().source("heights.geojson").attribute("ffh")
                .method(JoinMethod.NEAREST).maxDistance(5.0).unit(UnitSystem.FEET).build();

        Exposure result = heightService.setGroundFloorHeight(exposure(buildings), HeightSource.fromFile(join));

        assertEquals(10.0 / 3.28084, result.getTable().getDouble(1L, "ground_flht"), 1e-9);
        assertEquals(5.0 / 3.28084, result.getTable().getDouble(2L, "ground_flht"), 1e-9);
    }

    @Test
    void elevationFromDemIsReportedWhenItFallsBack() {
        when(rasterProvider.read("dem.asc", UTM31N)).thenReturn(ZonalStatisticsServiceTest.grid());

        Exposure result = heightService.setGroundElevation(exposure(buildings),
                HeightSource.dem("dem.asc", UTM31N, ZonalStatistic.MEAN, UnitSystem.METERS));

        assertEquals(11.5, result.getTable().getDouble(1L, "ground_elevtn"), 1e-9);
        assertEquals(7.0, result.getTable().getDouble(2L, "ground_elevtn"), 1e-9);
        assertEquals(1, result.getQualityLog().countOf("ELEVATION_FROM_CENTROID"));
    }

    @Test
    void raiseNeverLowersGroundFloor() {
        Exposure base = exposure(buildings, "ground_flht", 1.0, "ground_elevtn", 2.0);
        Exposure exposure = base.withTable(base.getTable().withValues("ground_elevtn", Map.of(2L, 0.0)));
        RaiseRequest request = RaiseRequest.builder().raiseBy(2.0).reference(HeightReference.DATUM).build();

        Exposure result = heightService.raiseGroundFloorHeight(exposure, request);

        // asset 1 already at 3.0 above datum, asset 2 at 1.0
        assertEquals(1.0, result.getTable().getDouble(1L, "ground_flht"), 1e-9);
        assertEquals(2.0, result.getTable().getDouble(2L, "ground_flht"), 1e-9);
        for (Long id : List.of(1L, 2L)) {
            double original = exposure.getTable().getDouble(id, "ground_flht") + exposure.getTable().getDouble(id, "ground_elevtn");
            double raised = result.getTable().getDouble(id, "ground_flht") + result.getTable().getDouble(id, "ground_elevtn");
            assertEquals(Math.max(original, 2.0), raised, 1e-9);
        }
    }

    @Test
    void raiseOnlyTouchesSelectedAssets() {
        Exposure exposure = exposure(buildings, "ground_flht", 0.0, "ground_elevtn", 0.0);
        RaiseRequest request = RaiseRequest.builder().objectIds(List.of(2L, 99L)).raiseBy(1.0).build();

        Exposure result = heightService.raiseGroundFloorHeight(exposure, request);

        assertEquals(0.0, result.getTable().getDouble(1L, "ground_flht"));
        assertEquals(1.0, result.getTable().getDouble(2L, "ground_flht"));
    }

    @Test
    void raiseRelativeToTableLevels() {
        Map<String, String> withoutLevel = new HashMap<>();
        withoutLevel.put("object_id", "2");
        withoutLevel.put("bfe", "");
        when(tabularProvider.read("bfe.csv")).thenReturn(new DataTable("bfe.csv", List.of("object_id", "bfe"),
                List.of(Map.of("object_id", "1", "bfe", "4"), withoutLevel)));
        Exposure exposure = exposure(buildings, "ground_flht", 0.5, "ground_elevtn", 2.0);
        RaiseRequest request = RaiseRequest.builder().raiseBy(1.0).reference(HeightReference.TABLE)
                .referenceTable("bfe.csv").tableAttribute("bfe").build();

        Exposure result = heightService.raiseGroundFloorHeight(exposure, request);

        assertEquals(3.0, result.getTable().getDouble(1L, "ground_flht"), 1e-9);
        assertEquals(0.5, result.getTable().getDouble(2L, "ground_flht"), 1e-9);
        assertEquals(1, result.getQualityLog().countOf("NO_REFERENCE_LEVEL"));
    }

    @Test
    void raiseRelativeToReferenceLayer() {
        when(geometryProvider.read(eq("bfe.geojson"), any(Region.class))).thenReturn(layer("bfe",
                feature(1, square(-10, -10, 100), "bfe", 3.0)));
        Exposure exposure = exposure(buildings, "ground_flht", 0.0, "ground_elevtn", 1.0);
        RaiseRequest request = RaiseRequest.builder().raiseBy(0.5).reference(HeightReference.GEOM)
                .referenceLayer(LayerJoin.builder().source("bfe.geojson").attribute("bfe").build()).build();

        Exposure result = heightService.raiseGroundFloorHeight(exposure, request);

        assertEquals(2.5, result.getTable().getDouble(1L, "ground_flht"), 1e-9);
        assertEquals(0, result.getQualityLog().countOf("NO_REFERENCE_LEVEL"));
    }

    @Test
    void geomReferenceNeedsLayer() {
        Exposure exposure = exposure(buildings, "ground_flht", 0.0);
        RaiseRequest request = RaiseRequest.builder().raiseBy(1.0).reference(HeightReference.GEOM).build();

        assertThrows(UserInputException.class, () -> heightService.raiseGroundFloorHeight(exposure, request));
    }
}
