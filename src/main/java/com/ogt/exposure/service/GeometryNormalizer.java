package com.ogt.exposure.service;

import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.util.DataQualityLog;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Guarantees one valid geometry per row: invalid polygons are repaired and multi-polygons are
 * reduced to their largest part.
 */
@Service
@Slf4j
public class GeometryNormalizer {

    static final String STEP = "geometry normalization";

    public FeatureLayer normalize(FeatureLayer layer, DataQualityLog qualityLog) {
        List<Feature> features = new ArrayList<>(layer.size());
        List<Long> repaired = new ArrayList<>();
        List<Long> reduced = new ArrayList<>();

        for (Feature f : layer.getFeatures()) {
            Geometry geom = f.getGeometry();
            if (geom == null || geom.isEmpty()) {
                features.add(f);
                continue;
            }
            if (geom instanceof Polygonal && !geom.isValid()) {
                Geometry fixed = repair(geom);
                if (fixed != geom) {
                    repaired.add(f.getId());
                    geom = fixed;
                }
            }
            if (geom instanceof MultiPolygon && geom.getNumGeometries() > 1) {
                reduced.add(f.getId());
            }
            features.add(f.withGeometry(largestPolygon(geom)));
        }

        qualityLog.warn(STEP, "INVALID_GEOMETRY_REPAIRED", repaired,
                "Invalid polygons repaired with buffer(0) in layer '" + layer.getName() + "'");
        qualityLog.warn(STEP, "MULTIPOLYGON_REDUCED", reduced,
                "Multi-part polygons reduced to their largest part in layer '" + layer.getName() + "'");
        return layer.withFeatures(features);
    }

    /**
     * Largest polygon of a multi-polygon. Ties keep the first part. Other geometries are returned as is.
     */
    public Geometry largestPolygon(Geometry geom) {
        if (!(geom instanceof MultiPolygon) || geom.getNumGeometries() == 0) {
            return geom;
        }
        Geometry largest = geom.getGeometryN(0);
        for (int i = 1; i < geom.getNumGeometries(); i++) {
            Geometry part = geom.getGeometryN(i);
            if (part.getArea() > largest.getArea()) {
                largest = part;
            }
        }
        largest.setSRID(geom.getSRID());
        return largest;
    }

    /**
     * Repairs an invalid geometry with the buffer(0) trick; returns the input when it is valid or
     * cannot be repaired.
     */
    public Geometry repair(Geometry geom) {
        IsValidOp validOp = new IsValidOp(geom);
        if (validOp.isValid()) {
            return geom;
        }
        TopologyValidationError error = validOp.getValidationError();
        Geometry fixed = geom.buffer(0);
        if (fixed.isValid() && !fixed.isEmpty()) {
            log.debug("Geometry repaired with buffer(0): {} at {}", getErrorTypeName(error.getErrorType()), error.getCoordinate());
            return fixed;
        }
        log.warn("⚠️ Geometry could not be repaired: {} ({})", getErrorTypeName(error.getErrorType()), error.getMessage());
        return geom;
    }

    private String getErrorTypeName(int errorType) {
        return switch (errorType) {
            case TopologyValidationError.ERROR -> "GENERIC_ERROR";
            case TopologyValidationError.REPEATED_POINT -> "REPEATED_POINT";
            case TopologyValidationError.HOLE_OUTSIDE_SHELL -> "HOLE_OUTSIDE_SHELL";
            case TopologyValidationError.NESTED_HOLES -> "NESTED_HOLES";
            case TopologyValidationError.DISCONNECTED_INTERIOR -> "DISCONNECTED_INTERIOR";
            case TopologyValidationError.SELF_INTERSECTION -> "SELF_INTERSECTION";
            case TopologyValidationError.RING_SELF_INTERSECTION -> "RING_SELF_INTERSECTION";
            case TopologyValidationError.NESTED_SHELLS -> "NESTED_SHELLS";
            case TopologyValidationError.DUPLICATE_RINGS -> "DUPLICATE_RINGS";
            case TopologyValidationError.TOO_FEW_POINTS -> "TOO_FEW_POINTS";
            case TopologyValidationError.INVALID_COORDINATE -> "INVALID_COORDINATE";
            case TopologyValidationError.RING_NOT_CLOSED -> "RING_NOT_CLOSED";
            default -> "UNKNOWN_ERROR_" + errorType;
        };
    }
}
