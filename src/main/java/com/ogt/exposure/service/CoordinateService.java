package com.ogt.exposure.service;

import com.ogt.exposure.exception.CrsMissingException;
import com.ogt.exposure.model.Crs;
import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.UnitSystem;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CRS harmonization: reprojection of layers and geometries, nearest local projected CRS and
 * metric measures (area, length) expressed in the model unit.
 */
@Service
@Slf4j
public class CoordinateService {

    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();

    /**
     * Returns {@code right} expressed in the CRS of {@code left}. Neither input is modified.
     *
     * @throws CrsMissingException when one of the layers has no CRS
     */
    public FeatureLayer harmonize(FeatureLayer left, FeatureLayer right) {
        requireCrs(left);
        requireCrs(right);
        if (left.getCrs().equals(right.getCrs())) {
            return right;
        }
        log.info("🔄 Reprojecting layer '{}' from {} to {} to combine it with '{}'",
                right.getName(), right.getCrs(), left.getCrs(), left.getName());
        return reproject(right, left.getCrs());
    }

    public FeatureLayer reproject(FeatureLayer layer, Crs target) {
        requireCrs(layer);
        if (layer.getCrs().equals(target)) {
            return layer;
        }
        CoordinateTransform transform = transformFactory.createTransform(
                layer.getCrs().getDefinition(), target.getDefinition());

        List<Feature> features = new ArrayList<>(layer.size());
        for (Feature f : layer.getFeatures()) {
            features.add(f.withGeometry(transform(f.getGeometry(), transform)));
        }
        return new FeatureLayer(layer.getName(), target, features);
    }

    public Geometry transform(Geometry geometry, Crs source, Crs target) {
        if (geometry == null || source.equals(target)) {
            return geometry;
        }
        return transform(geometry, transformFactory.createTransform(source.getDefinition(), target.getDefinition()));
    }

    public Coordinate transform(Coordinate coordinate, Crs source, Crs target) {
        if (source.equals(target)) {
            return new Coordinate(coordinate);
        }
        CoordinateTransform transform = transformFactory.createTransform(source.getDefinition(), target.getDefinition());
        ProjCoordinate out = new ProjCoordinate();
        transform.transform(new ProjCoordinate(coordinate.x, coordinate.y), out);
        log.debug("Conversion: ({}, {}) [{}] -> ({}, {}) [{}]", coordinate.x, coordinate.y, source, out.x, out.y, target);
        return new Coordinate(out.x, out.y);
    }

    /**
     * UTM zone (WGS84) containing the centre of geographic bounds given in longitude/latitude.
     */
    public Crs detectUtmZone(Envelope lonLatBounds) {
        if (lonLatBounds == null || lonLatBounds.isNull()) {
            throw new IllegalArgumentException("Bounds cannot be empty when detecting the UTM zone");
        }
        Coordinate centre = lonLatBounds.centre();
        int zone = (int) Math.floor((centre.x + 180.0) / 6.0) + 1;
        zone = Math.max(1, Math.min(60, zone));
        Crs utm = Crs.utm(zone, centre.y >= 0);
        log.debug("Longitude {} / latitude {} -> {}", centre.x, centre.y, utm);
        return utm;
    }

    /**
     * The layer itself when it is projected, otherwise the layer reprojected to its nearest UTM zone.
     */
    public FeatureLayer toLocalProjected(FeatureLayer layer) {
        requireCrs(layer);
        if (!layer.getCrs().isGeographic() || layer.isEmpty()) {
            return layer;
        }
        FeatureLayer lonLat = reproject(layer, Crs.WGS84);
        return reproject(lonLat, detectUtmZone(lonLat.getBounds()));
    }

    /**
     * Footprint area per feature id in the square of the model unit; 0 for points and lines.
     */
    public Map<Long, Double> areas(FeatureLayer layer, UnitSystem modelUnit) {
        FeatureLayer projected = toLocalProjected(layer);
        UnitSystem crsUnit = projected.getCrs().isFeet() ? UnitSystem.FEET : UnitSystem.METERS;
        Map<Long, Double> areas = new LinkedHashMap<>();
        for (Feature f : projected.getFeatures()) {
            Geometry g = f.getGeometry();
            double area = g instanceof Polygonal ? g.getArea() : 0.0;
            areas.put(f.getId(), crsUnit.convertAreaTo(area, modelUnit));
        }
        return areas;
    }

    /**
     * Length per feature id in the model unit; 0 for points and polygons.
     */
    public Map<Long, Double> lengths(FeatureLayer layer, UnitSystem modelUnit) {
        FeatureLayer projected = toLocalProjected(layer);
        UnitSystem crsUnit = projected.getCrs().isFeet() ? UnitSystem.FEET : UnitSystem.METERS;
        Map<Long, Double> lengths = new LinkedHashMap<>();
        for (Feature f : projected.getFeatures()) {
            Geometry g = f.getGeometry();
            double length = g instanceof Lineal ? g.getLength() : 0.0;
            lengths.put(f.getId(), crsUnit.convertTo(length, modelUnit));
        }
        return lengths;
    }

    public void requireCrs(FeatureLayer layer) {
        if (layer.getCrs() == null) {
            throw new CrsMissingException(layer.getName());
        }
    }

    private Geometry transform(Geometry geometry, CoordinateTransform transform) {
        if (geometry == null) {
            return null;
        }
        Geometry copy = geometry.copy();
        copy.apply(new CoordinateSequenceFilter() {
            private final ProjCoordinate in = new ProjCoordinate();
            private final ProjCoordinate out = new ProjCoordinate();

            @Override
            public void filter(CoordinateSequence seq, int i) {
                in.x = seq.getX(i);
                in.y = seq.getY(i);
                transform.transform(in, out);
                seq.setOrdinate(i, CoordinateSequence.X, out.x);
                seq.setOrdinate(i, CoordinateSequence.Y, out.y);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public boolean isGeometryChanged() {
                return true;
            }
        });
        return copy;
    }
}
