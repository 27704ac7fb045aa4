package com.ogt.exposure.service;

import com.ogt.exposure.exception.JoinMethodUnsupportedException;
import com.ogt.exposure.exception.MissingColumnException;
import com.ogt.exposure.model.Crs;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.JoinMethod;
import com.ogt.exposure.util.DataQualityLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ogt.exposure.TestLayers.GF;
import static com.ogt.exposure.TestLayers.feature;
import static com.ogt.exposure.TestLayers.layer;
import static com.ogt.exposure.TestLayers.line;
import static com.ogt.exposure.TestLayers.point;
import static com.ogt.exposure.TestLayers.rectangle;
import static com.ogt.exposure.TestLayers.square;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SpatialJoinServiceTest {

    private final SpatialJoinService joinService = new SpatialJoinService(new CoordinateService());

    @Test
    void nearestBeyondMaxDistanceGivesNull() {
        FeatureLayer assets = layer("assets", feature(1, point(0, 0)), feature(2, point(100, 0)));
        FeatureLayer heights = layer("heights", feature(1, point(15, 0), "height", 3.0), feature(2, point(104, 0), "height", 1.5));

        JoinResult result = joinService.join(assets, heights, "height", JoinMethod.NEAREST, 10.0);

        assertNull(result.getValues().get(1L));
        assertEquals(1.5, result.getValues().get(2L));
        assertEquals(List.of(1L), result.getUnmatched());
    }

    @Test
    void nearestTieGoesToEarliestReference() {
        FeatureLayer assets = layer("assets", feature(1, point(0, 0)));
        FeatureLayer ref = layer("ref", feature(1, point(5, 0), "v", "first"), feature(2, point(-5, 0), "v", "second"));

        assertEquals("first", joinService.join(assets, ref, "v", JoinMethod.NEAREST, 10.0).getValues().get(1L));
    }

    @Test
    void intersectionTakesLargestOverlap() {
        FeatureLayer buildings = layer("buildings", feature(1, square(0, 0, 10)));
        FeatureLayer zones = layer("zones",
                feature(1, rectangle(-5, 0, 8, 10), "zone", "A"),   // 3 x 10 overlap
                feature(2, rectangle(3, 0, 20, 10), "zone", "B"));  // 7 x 10 overlap

        assertEquals("B", joinService.join(buildings, zones, "zone", JoinMethod.INTERSECTION, 0).getValues().get(1L));
    }

    @Test
    void intersectionTieGoesToEarliestReference() {
        FeatureLayer buildings = layer("buildings", feature(1, square(0, 0, 10)));
        FeatureLayer zones = layer("zones",
                feature(1, rectangle(-10, 0, 15, 10), "zone", "west"),
                feature(2, rectangle(5, 0, 15, 10), "zone", "east"));

        assertEquals("west", joinService.join(buildings, zones, "zone", JoinMethod.INTERSECTION, 0).getValues().get(1L));
    }

    @Test
    void pointTakesCoveringPolygon() {
        FeatureLayer points = layer("points", feature(1, point(5, 5)), feature(2, point(50, 50)));
        FeatureLayer zones = layer("zones", feature(1, square(0, 0, 10), "landuse", "RES"));

        JoinResult result = joinService.join(points, zones, "landuse", JoinMethod.INTERSECTION, 0);

        assertEquals("RES", result.getValues().get(1L));
        assertNull(result.getValues().get(2L));
        assertEquals(1, result.matchedCount());
    }

    @Test
    void lineOnPolygonIntersectionIsUnsupported() {
        FeatureLayer roads = layer("roads", feature(1, line(0, 0, 10, 10)));
        FeatureLayer zones = layer("zones", feature(1, square(0, 0, 10), "zone", "A"));

        assertThrows(JoinMethodUnsupportedException.class,
                () -> joinService.join(roads, zones, "zone", JoinMethod.INTERSECTION, 0));
    }

    @Test
    void resultHasOneEntryPerPrimaryFeature() {
        FeatureLayer buildings = layer("buildings",
                feature(7, square(0, 0, 4)), feature(3, square(20, 0, 4)), feature(9, square(40, 0, 4)));
        FeatureLayer zones = layer("zones",
                feature(1, square(-1, -1, 30), "zone", "A"),
                feature(2, square(-1, -1, 30), "zone", "A-copy"),
                feature(3, square(19, -1, 6), "zone", "B"));

        JoinResult result = joinService.join(buildings, zones, "zone", JoinMethod.INTERSECTION, 0);

        assertEquals(3, result.size());
        assertEquals(List.of(7L, 3L, 9L), List.copyOf(result.getValues().keySet()));
        assertEquals(List.of(9L), result.getUnmatched());
    }

    @Test
    void missingReferenceAttributeIsRejected() {
        FeatureLayer buildings = layer("buildings", feature(1, square(0, 0, 4)));
        FeatureLayer zones = layer("zones", feature(1, square(0, 0, 4), "zone", "A"));

        assertThrows(MissingColumnException.class,
                () -> joinService.join(buildings, zones, "height", JoinMethod.INTERSECTION, 0));
    }

    @Test
    void referenceInOtherCrsIsReprojectedBeforeJoining() {
        FeatureLayer assets = layer("assets", feature(1, point(500000, 5650000)));
        FeatureLayer lonLat = new FeatureLayer("zones", Crs.WGS84,
                List.of(feature(1, square(2.9, 50.9, 0.2), "zone", "Z")));

        assertEquals("Z", joinService.join(assets, lonLat, "zone", JoinMethod.INTERSECTION, 0).getValues().get(1L));
    }

    @Test
    void joinByLocationUsesInteriorPointForLines() {
        FeatureLayer mixed = layer("assets", feature(1, square(1, 1, 2)), feature(2, line(5, 5, 7, 5)));
        FeatureLayer zones = layer("zones", feature(1, square(0, 0, 10), "zone", "A"));

        JoinResult result = joinService.joinByLocation(mixed, zones, "zone", new DataQualityLog());

        assertEquals("A", result.getValues().get(1L));
        assertEquals("A", result.getValues().get(2L));
        assertEquals(List.of(1L, 2L), List.copyOf(result.getValues().keySet()));
    }

    @Test
    void joinByLocationGivesNullToFeaturesWithoutGeometry() {
        FeatureLayer assets = layer("assets",
                feature(1, square(1, 1, 2)),
                feature(2, null),
                feature(3, GF.createPoint()));
        FeatureLayer zones = layer("zones", feature(1, square(0, 0, 10), "zone", "A"));
        DataQualityLog qualityLog = new DataQualityLog();

        JoinResult result = joinService.joinByLocation(assets, zones, "zone", qualityLog);

        assertEquals("A", result.getValues().get(1L));
        assertNull(result.getValues().get(2L));
        assertNull(result.getValues().get(3L));
        assertEquals(List.of(2L, 3L), result.getUnmatched());
        assertEquals(2, qualityLog.countOf("NO_GEOMETRY"));
    }
}
