package com.ogt.exposure.service;

import com.ogt.exposure.exception.JoinMethodUnsupportedException;
import com.ogt.exposure.exception.MissingColumnException;
import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.JoinMethod;
import com.ogt.exposure.util.DataQualityLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.Puntal;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.index.strtree.STRtree;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches one attribute of a reference layer onto every feature of a primary layer.
 * <p>
 * The result always has one entry per primary feature. The reference layer is reprojected onto
 * the primary CRS first; both strategies query an STR-tree built over the reference features.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpatialJoinService {

    static final String STEP = "spatial join";

    private final CoordinateService coordinateService;

    enum GeometryKind { POINT, LINE, POLYGON, MIXED, EMPTY }

    public JoinResult join(FeatureLayer primary, FeatureLayer reference, String attribute,
                           JoinMethod method, double maxDistance) {
        // 1. Same CRS on both sides
        FeatureLayer ref = coordinateService.harmonize(primary, reference);

        // 2. The attribute has to exist somewhere in the reference layer
        if (!ref.isEmpty() && !ref.hasProperty(attribute)) {
            throw new MissingColumnException(STEP + " with '" + ref.getName() + "'", attribute);
        }

        // 3. Dispatch on method and geometry types
        Map<Long, Object> values;
        if (ref.isEmpty() || primary.isEmpty()) {
            values = new LinkedHashMap<>();
            primary.getFeatures().forEach(f -> values.put(f.getId(), null));
        } else if (method == JoinMethod.NEAREST) {
            values = nearest(primary, ref, attribute, maxDistance);
        } else {
            values = intersection(primary, ref, attribute);
        }

        // 4. Report the features that got nothing
        List<Long> unmatched = new ArrayList<>();
        values.forEach((id, v) -> {
            if (v == null) {
                unmatched.add(id);
            }
        });
        log.info("✅ Joined '{}' from '{}' onto {}/{} features of '{}' ({})",
                attribute, ref.getName(), values.size() - unmatched.size(), values.size(), primary.getName(), method);
        return new JoinResult(values, unmatched);
    }

    /**
     * Intersection join that accepts any mix of asset geometries: footprints take the reference
     * polygon they overlap most, points and lines use their interior point. Features without a
     * geometry get null and are recorded as {@code NO_GEOMETRY}.
     */
    public JoinResult joinByLocation(FeatureLayer primary, FeatureLayer zones, String attribute,
                                     DataQualityLog qualityLog) {
        List<Feature> polygons = new ArrayList<>();
        List<Feature> points = new ArrayList<>();
        List<Long> withoutGeometry = new ArrayList<>();
        for (Feature f : primary.getFeatures()) {
            Geometry g = f.getGeometry();
            if (g == null || g.isEmpty()) {
                withoutGeometry.add(f.getId());
            } else if (g instanceof Polygonal) {
                polygons.add(f);
            } else {
                points.add(f.withGeometry(g.getInteriorPoint()));
            }
        }
        qualityLog.warn(STEP, "NO_GEOMETRY", withoutGeometry,
                "Features without a geometry get no '" + attribute + "' from '" + zones.getName() + "'");

        Map<Long, Object> joined = new LinkedHashMap<>();
        if (!polygons.isEmpty()) {
            joined.putAll(join(primary.withFeatures(polygons), zones, attribute, JoinMethod.INTERSECTION, 0).getValues());
        }
        if (!points.isEmpty()) {
            joined.putAll(join(primary.withFeatures(points), zones, attribute, JoinMethod.INTERSECTION, 0).getValues());
        }

        Map<Long, Object> values = new LinkedHashMap<>();
        List<Long> unmatched = new ArrayList<>();
        for (Long id : primary.getIds()) {
            Object v = joined.get(id);
            values.put(id, v);
            if (v == null) {
                unmatched.add(id);
            }
        }
        return new JoinResult(values, unmatched);
    }

    private Map<Long, Object> nearest(FeatureLayer primary, FeatureLayer ref, String attribute, double maxDistance) {
        List<Point> refPoints = new ArrayList<>(ref.size());
        STRtree index = new STRtree();
        for (int i = 0; i < ref.size(); i++) {
            Point p = representativePoint(ref.getFeatures().get(i).getGeometry());
            refPoints.add(p);
            if (p != null) {
                index.insert(p.getEnvelopeInternal(), i);
            }
        }

        Map<Long, Object> values = new LinkedHashMap<>();
        for (Feature f : primary.getFeatures()) {
            Point p = representativePoint(f.getGeometry());
            if (p == null) {
                values.put(f.getId(), null);
                continue;
            }
            Envelope search = new Envelope(p.getCoordinate());
            search.expandBy(maxDistance);

            int best = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (Object o : index.query(search)) {
                int i = (Integer) o;
                double d = p.distance(refPoints.get(i));
                if (d > maxDistance) {
                    continue;
                }
                if (d < bestDistance || (d == bestDistance && i < best)) {
                    best = i;
                    bestDistance = d;
                }
            }
            values.put(f.getId(), best < 0 ? null : ref.getFeatures().get(best).getProperty(attribute));
        }
        return values;
    }

    private Map<Long, Object> intersection(FeatureLayer primary, FeatureLayer ref, String attribute) {
        GeometryKind primaryKind = kindOf(primary);
        GeometryKind refKind = kindOf(ref);
        boolean polygonPolygon = primaryKind == GeometryKind.POLYGON && refKind == GeometryKind.POLYGON;
        boolean pointPolygon = primaryKind == GeometryKind.POINT && refKind == GeometryKind.POLYGON;
        if (!polygonPolygon && !pointPolygon) {
            throw new JoinMethodUnsupportedException(JoinMethod.INTERSECTION, primaryKind.name(), refKind.name());
        }

        STRtree index = new STRtree();
        for (int i = 0; i < ref.size(); i++) {
            Geometry g = ref.getFeatures().get(i).getGeometry();
            if (g != null && !g.isEmpty()) {
                index.insert(g.getEnvelopeInternal(), i);
            }
        }

        Map<Long, Object> values = new LinkedHashMap<>();
        for (Feature f : primary.getFeatures()) {
            Geometry g = f.getGeometry();
            if (g == null || g.isEmpty()) {
                values.put(f.getId(), null);
                continue;
            }
            List<Integer> candidates = candidates(index, g.getEnvelopeInternal());
            int match = polygonPolygon ? largestOverlap(g, ref, candidates) : firstCovering(g, ref, candidates);
            values.put(f.getId(), match < 0 ? null : ref.getFeatures().get(match).getProperty(attribute));
        }
        return values;
    }

    /** Earliest reference wins a tie: candidates are scanned in insertion order with a strict comparison. */
    private int largestOverlap(Geometry g, FeatureLayer ref, List<Integer> candidates) {
        int best = -1;
        double bestArea = 0.0;
        for (int i : candidates) {
            double area = overlapArea(g, ref.getFeatures().get(i).getGeometry());
            if (area > bestArea) {
                best = i;
                bestArea = area;
            }
        }
        return best;
    }

    private int firstCovering(Geometry point, FeatureLayer ref, List<Integer> candidates) {
        for (int i : candidates) {
            if (ref.getFeatures().get(i).getGeometry().covers(point)) {
                return i;
            }
        }
        return -1;
    }

    private double overlapArea(Geometry a, Geometry b) {
        try {
            return a.intersection(b).getArea();
        } catch (TopologyException e) {
            log.debug("Intersection failed ({}), retrying on repaired geometries", e.getMessage());
            return a.buffer(0).intersection(b.buffer(0)).getArea();
        }
    }

    @SuppressWarnings("unchecked")
    private List<Integer> candidates(STRtree index, Envelope envelope) {
        List<Integer> hits = new ArrayList<>((List<Integer>) index.query(envelope));
        hits.sort(Integer::compareTo);
        return hits;
    }

    static Point representativePoint(Geometry g) {
        if (g == null || g.isEmpty()) {
            return null;
        }
        return g instanceof Point p ? p : g.getCentroid();
    }

    static GeometryKind kindOf(FeatureLayer layer) {
        GeometryKind kind = GeometryKind.EMPTY;
        for (Feature f : layer.getFeatures()) {
            Geometry g = f.getGeometry();
            if (g == null || g.isEmpty()) {
                continue;
            }
            GeometryKind k = g instanceof Puntal ? GeometryKind.POINT
                    : g instanceof Lineal ? GeometryKind.LINE
                    : g instanceof Polygonal ? GeometryKind.POLYGON
                    : GeometryKind.MIXED;
            if (kind == GeometryKind.EMPTY) {
                kind = k;
            } else if (kind != k) {
                return GeometryKind.MIXED;
            }
        }
        return kind;
    }
}
