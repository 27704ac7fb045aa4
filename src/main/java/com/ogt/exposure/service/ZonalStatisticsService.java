package com.ogt.exposure.service;

import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.RasterGrid;
import com.ogt.exposure.model.ZonalStatistic;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.GeometryItemDistance;
import org.locationtech.jts.index.strtree.STRtree;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raster value per feature: statistic over the cells whose centre falls in the footprint, then
 * the cell under the centroid, then the value of the nearest feature that got one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ZonalStatisticsService {

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    private final CoordinateService coordinateService;

    @Value
    public static class ZonalResult {
        Map<Long, Double> values;
        List<Long> centroidFallback;
        List<Long> nearestFallback;
        List<Long> unresolved;
    }

    public ZonalResult sample(FeatureLayer layer, RasterGrid grid, ZonalStatistic statistic) {
        FeatureLayer local = grid.getCrs() == null ? layer : coordinateService.reproject(layer, grid.getCrs());

        Map<Long, Double> values = new LinkedHashMap<>();
        List<Long> centroidFallback = new ArrayList<>();
        List<Long> missing = new ArrayList<>();

        // 1. Zonal statistic, 2. centroid resample
        for (Feature f : local.getFeatures()) {
            Geometry g = f.getGeometry();
            Double value = null;
            if (g != null && !g.isEmpty()) {
                if (g instanceof Polygonal) {
                    value = statistic.apply(cellValuesWithin(g, grid));
                }
                if (value == null) {
                    Point c = g.getCentroid();
                    value = grid.sample(c.getX(), c.getY());
                    if (value != null && g instanceof Polygonal) {
                        centroidFallback.add(f.getId());
                    }
                }
            }
            values.put(f.getId(), value);
            if (value == null) {
                missing.add(f.getId());
            }
        }

        // 3. Nearest resolved neighbour
        List<Long> nearestFallback = new ArrayList<>();
        List<Long> unresolved = new ArrayList<>();
        if (!missing.isEmpty()) {
            STRtree index = new STRtree();
            Map<Long, Feature> byId = local.byId();
            values.forEach((id, v) -> {
                Point p = SpatialJoinService.representativePoint(byId.get(id).getGeometry());
                if (v != null && p != null) {
                    Point item = geometryFactory.createPoint(new Coordinate(p.getX(), p.getY()));
                    item.setUserData(id);
                    index.insert(item.getEnvelopeInternal(), item);
                }
            });
            for (Long id : missing) {
                Point p = SpatialJoinService.representativePoint(byId.get(id).getGeometry());
                if (p == null || index.size() == 0) {
                    unresolved.add(id);
                    continue;
                }
                Point probe = geometryFactory.createPoint(new Coordinate(p.getX(), p.getY()));
                Point nearest = (Point) index.nearestNeighbour(probe.getEnvelopeInternal(), probe, new GeometryItemDistance());
                values.put(id, values.get((Long) nearest.getUserData()));
                nearestFallback.add(id);
            }
        }

        log.debug("Zonal {}: {} features, {} centroid fallbacks, {} nearest fallbacks, {} unresolved",
                statistic, values.size(), centroidFallback.size(), nearestFallback.size(), unresolved.size());
        return new ZonalResult(values, centroidFallback, nearestFallback, unresolved);
    }

    /** Valid values of the cells whose centre is covered by the geometry; only the bounding window is scanned. */
    private double[] cellValuesWithin(Geometry g, RasterGrid grid) {
        Envelope env = g.getEnvelopeInternal();
        int c0 = Math.max(0, grid.columnOf(env.getMinX()));
        int c1 = Math.min(grid.getColumns() - 1, grid.columnOf(env.getMaxX()));
        int r0 = Math.max(0, grid.rowOf(env.getMaxY()));
        int r1 = Math.min(grid.getRows() - 1, grid.rowOf(env.getMinY()));

        PreparedGeometry prepared = PreparedGeometryFactory.prepare(g);
        List<Double> found = new ArrayList<>();
        for (int r = r0; r <= r1; r++) {
            for (int c = c0; c <= c1; c++) {
                Double v = grid.valueAt(c, r);
                if (v == null) {
                    continue;
                }
                Point centre = geometryFactory.createPoint(new Coordinate(grid.cellCenterX(c), grid.cellCenterY(r)));
                if (prepared.covers(centre)) {
                    found.add(v);
                }
            }
        }
        return found.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
