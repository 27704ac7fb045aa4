package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;
import com.ogt.exposure.util.DataQualityLog;
import lombok.Value;
import lombok.With;

import java.util.HashSet;
import java.util.Set;

/**
 * An exposure model under construction: the asset table, the geometry layer that owns one
 * geometry per object_id, the companion damage curves and the data-quality log of the run.
 */
@Value
@With
public class Exposure {

    ExposureTable table;
    FeatureLayer geometries;
    DamageCurveSet curves;
    DataQualityLog qualityLog;

    public static Exposure of(ExposureTable table, FeatureLayer geometries) {
        return new Exposure(table, geometries, null, new DataQualityLog());
    }

    public Exposure(ExposureTable table, FeatureLayer geometries, DamageCurveSet curves, DataQualityLog qualityLog) {
        if (geometries != null) {
            Set<Long> geometryIds = new HashSet<>(geometries.getIds());
            if (geometryIds.size() != geometries.size()) {
                throw new UserInputException("Geometry layer '" + geometries.getName() + "' has duplicate object ids");
            }
            if (!geometryIds.equals(new HashSet<>(table.getObjectIds()))) {
                throw new UserInputException("Exposure table and geometry layer are not 1:1 on object_id");
            }
        }
        this.table = table;
        this.geometries = geometries;
        this.curves = curves;
        this.qualityLog = qualityLog != null ? qualityLog : new DataQualityLog();
    }

    public Crs getCrs() {
        return geometries == null ? null : geometries.getCrs();
    }

    /** Replaces table and geometries together, keeping the 1:1 pairing checked. */
    public Exposure withTableAndGeometries(ExposureTable newTable, FeatureLayer newGeometries) {
        return new Exposure(newTable, newGeometries, curves, qualityLog);
    }
}
