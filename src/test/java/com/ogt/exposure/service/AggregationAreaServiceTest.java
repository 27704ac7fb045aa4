package com.ogt.exposure.service;

import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.model.AggregationArea;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.Region;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Polygon;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.ogt.exposure.TestLayers.GF;
import static com.ogt.exposure.TestLayers.exposure;
import static com.ogt.exposure.TestLayers.feature;
import static com.ogt.exposure.TestLayers.layer;
import static com.ogt.exposure.TestLayers.point;
import static com.ogt.exposure.TestLayers.square;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AggregationAreaServiceTest {

    private final GeometrySourceProvider geometryProvider = mock(GeometrySourceProvider.class);
    private final AggregationAreaService aggregationService = new AggregationAreaService(
            new SpatialJoinService(new CoordinateService()), new AttributeMerger(), geometryProvider);

    @Test
    void labelsAssetsPerAggregation() {
        FeatureLayer assets = layer("assets",
                feature(1, square(1, 1, 2)),
                feature(2, point(15, 5)),
                feature(3, point(100, 100)));
        when(geometryProvider.read(eq("districts.geojson"), any(Region.class))).thenReturn(layer("districts",
                feature(1, square(0, 0, 10), "name", "North"),
                feature(2, GF.createMultiPolygon(new Polygon[]{
                        square(10, 0, 10), square(50, 50, 1)}), "name", 7)));
        when(geometryProvider.read(eq("zip.geojson"), any(Region.class))).thenReturn(layer("zip",
                feature(1, square(0, 0, 200), "zip", "1011")));

        Map<String, AggregationArea> areas = new LinkedHashMap<>();
        areas.put("district", new AggregationArea("districts.geojson", "name"));
        areas.put("zip", new AggregationArea("zip.geojson", "zip"));

        Exposure result = aggregationService.assign(exposure(assets), areas);

        assertEquals("North", result.getTable().get(1L, "aggregation_label_district"));
        assertEquals("7", result.getTable().get(2L, "aggregation_label_district"));
        assertNull(result.getTable().get(3L, "aggregation_label_district"));
        assertEquals("1011", result.getTable().get(3L, "aggregation_label_zip"));
        assertEquals(1, result.getQualityLog().countOf("OUTSIDE_AGGREGATION_AREA"));
    }

    @Test
    void assetWithoutGeometryStaysUnlabelled() {
        FeatureLayer assets = layer("assets", feature(1, square(0, 0, 10)), feature(2, null));
        when(geometryProvider.read(eq("districts.geojson"), any(Region.class))).thenReturn(layer("districts",
                feature(1, square(-5, -5, 30), "name", "North")));

        Exposure result = aggregationService.assign(exposure(assets),
                Map.of("district", new AggregationArea("districts.geojson", "name")));

        assertEquals("North", result.getTable().get(1L, "aggregation_label_district"));
        assertNull(result.getTable().get(2L, "aggregation_label_district"));
        assertEquals(1, result.getQualityLog().countOf("NO_GEOMETRY"));
    }
}
