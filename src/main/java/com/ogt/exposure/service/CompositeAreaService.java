package com.ogt.exposure.service;

import com.ogt.exposure.config.ExposureProperties;
import com.ogt.exposure.exception.UserInputException;
import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.model.CompositeGrowthSpec;
import com.ogt.exposure.model.DamageCurveSet;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureColumns;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.ExtractionMethod;
import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.HeightReference;
import com.ogt.exposure.util.DataQualityLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.exposure.model.ExposureColumns.EXTRACTION_METHOD;
import static com.ogt.exposure.model.ExposureColumns.GROUND_ELEVATION;
import static com.ogt.exposure.model.ExposureColumns.GROUND_FLOOR_HEIGHT;
import static com.ogt.exposure.model.ExposureColumns.OBJECT_ID;
import static com.ogt.exposure.model.ExposureColumns.OBJECT_NAME;
import static com.ogt.exposure.model.ExposureColumns.PRIMARY_OBJECT_TYPE;
import static com.ogt.exposure.model.ExposureColumns.SECONDARY_OBJECT_TYPE;

/**
 * Adds hypothetical development areas carrying a share of today's total damage and a composite
 * damage curve blended from the curves in use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompositeAreaService {

    static final String STEP = "new composite areas";
    public static final String NEW_DEVELOPMENT_AREA = "New development area";
    public static final String COMPOSITE_CURVE_PREFIX = "composite_";

    private final ExposureProperties properties;
    private final CoordinateService coordinateService;
    private final GeometryNormalizer geometryNormalizer;
    private final HeightElevationService heightElevationService;
    private final AggregationAreaService aggregationAreaService;
    private final GeometrySourceProvider geometryProvider;

    public Exposure addCompositeAreas(Exposure exposure, CompositeGrowthSpec spec) {
        if (exposure.getGeometries() == null) {
            throw new IllegalStateException("Asset geometries are required for " + STEP);
        }
        ExposureTable table = exposure.getTable();
        for (String type : spec.getDamageTypes()) {
            table.requireColumns(STEP, ExposureColumns.maxDamage(type));
        }
        log.info("🏘️ Adding new development areas from '{}' with {}% of the current damage",
                spec.getGeometrySource(), spec.getPercentGrowth());

        // 1. Polygons in the exposure CRS, one part each
        FeatureLayer polygons = coordinateService.harmonize(exposure.getGeometries(),
                geometryNormalizer.normalize(geometryProvider.read(spec.getGeometrySource()), exposure.getQualityLog()));
        if (polygons.isEmpty()) {
            throw new UserInputException("No development area found in '" + spec.getGeometrySource() + "'");
        }
        Map<Long, Double> areas = coordinateService.areas(polygons, properties.getUnitSystem());
        double totalArea = areas.values().stream().mapToDouble(Double::doubleValue).sum();
        if (totalArea <= 0) {
            throw new UserInputException("Development areas in '" + spec.getGeometrySource() + "' have no area");
        }

        // 2. New ids above the current maximum, in polygon order
        long nextId = table.maxObjectId() + 1;
        List<Feature> newFeatures = new ArrayList<>();
        Map<Long, Double> shares = new LinkedHashMap<>();
        Map<Long, Double> heights = new LinkedHashMap<>();
        for (Feature polygon : polygons.getFeatures()) {
            long id = nextId++;
            newFeatures.add(Feature.of(id, polygon.getGeometry()));
            shares.put(id, areas.get(polygon.getId()) / totalArea);
            heights.put(id, heightOf(polygon, spec));
        }
        FeatureLayer newLayer = new FeatureLayer(exposure.getGeometries().getName(), exposure.getCrs(), newFeatures);

        // 3. Damage share and composite curve per damage type
        DamageCurveSet curves = exposure.getCurves();
        Map<String, String> compositeCurves = new LinkedHashMap<>();
        for (String type : spec.getDamageTypes()) {
            String curveId = COMPOSITE_CURVE_PREFIX + type;
            double[] blended = blendCurves(table, curves, type, exposure.getQualityLog());
            if (blended != null) {
                curves = curves.withCurve(curveId, blended);
                compositeCurves.put(type, curveId);
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (Feature f : newFeatures) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(OBJECT_ID, f.getId());
            row.put(OBJECT_NAME, NEW_DEVELOPMENT_AREA + ": " + f.getId());
            row.put(PRIMARY_OBJECT_TYPE, NEW_DEVELOPMENT_AREA);
            row.put(SECONDARY_OBJECT_TYPE, NEW_DEVELOPMENT_AREA);
            row.put(EXTRACTION_METHOD, ExtractionMethod.AREA.getCode());
            row.put(GROUND_FLOOR_HEIGHT, 0.0);
            row.put(GROUND_ELEVATION, 0.0);
            for (String type : spec.getDamageTypes()) {
                double total = spec.getPercentGrowth() / 100.0 * table.sum(ExposureColumns.maxDamage(type));
                row.put(ExposureColumns.maxDamage(type), total * shares.get(f.getId()));
                row.put(ExposureColumns.damageFunction(type), compositeCurves.get(type));
            }
            rows.add(row);
        }
        Exposure added = new Exposure(ExposureTable.fromRows(rows), newLayer, curves, exposure.getQualityLog());

        // 4. Ground elevation, then ground floor height
        if (spec.getGroundElevation() != null) {
            added = added.withTable(added.getTable().withValues(GROUND_ELEVATION,
                    heightElevationService.sampleDem(added, newLayer, spec.getGroundElevation())));
        }
        added = setGroundFloorHeight(added, spec, heights);

        // 5. Aggregation labels
        if (!spec.getAggregationAreas().isEmpty()) {
            added = aggregationAreaService.assign(added, spec.getAggregationAreas());
        }

        log.info("✅ {} new development areas added (ids {}..{})", newFeatures.size(),
                newFeatures.get(0).getId(), newFeatures.get(newFeatures.size() - 1).getId());
        return new Exposure(table.append(added.getTable()),
                exposure.getGeometries().append(newFeatures), curves, exposure.getQualityLog());
    }

    /**
     * Occurrence-weighted blend of the curves assigned for one damage type:
     * {@code sum(curve_i(depth) * count_i) / sum(count_i)}.
     */
    double[] blendCurves(ExposureTable table, DamageCurveSet curves, String damageType, DataQualityLog qualityLog) {
        String column = ExposureColumns.damageFunction(damageType);
        if (curves == null || !table.hasColumn(column)) {
            log.warn("⚠️ No damage functions to blend for '{}', new areas get none", damageType);
            return null;
        }
        double[] blended = new double[curves.getDepths().length];
        long totalCount = 0;
        List<String> unknown = new ArrayList<>();
        for (Map.Entry<String, Long> e : table.valueCounts(column).entrySet()) {
            if (!curves.contains(e.getKey())) {
                unknown.add(e.getKey());
                continue;
            }
            double[] fractions = curves.getFractions(e.getKey());
            for (int i = 0; i < blended.length; i++) {
                blended[i] += fractions[i] * e.getValue();
            }
            totalCount += e.getValue();
        }
        qualityLog.warn(STEP, "UNKNOWN_DAMAGE_FUNCTION", unknown,
                "Damage functions not in the curve set are left out of the '" + damageType + "' blend");
        if (totalCount == 0) {
            return null;
        }
        for (int i = 0; i < blended.length; i++) {
            blended[i] /= totalCount;
        }
        return blended;
    }

    private Exposure setGroundFloorHeight(Exposure added, CompositeGrowthSpec spec, Map<Long, Double> heights) {
        List<Long> ids = added.getTable().getObjectIds();
        Map<Long, Double> reference;
        if (spec.getElevationReference() == HeightReference.GEOM) {
            reference = heightElevationService.referenceFromLayer(added, ids, spec.getHeightReferenceLayer());
        } else {
            reference = new LinkedHashMap<>();
            for (Long id : ids) {
                reference.put(id, 0.0);
            }
        }

        ExposureTable table = added.getTable();
        Map<Long, Object> flht = new LinkedHashMap<>();
        List<Long> withoutReference = new ArrayList<>();
        for (Long id : ids) {
            Double ref = reference.get(id);
            if (ref == null) {
                withoutReference.add(id);
                continue;
            }
            double elevation = table.getDouble(id, GROUND_ELEVATION) == null ? 0.0 : table.getDouble(id, GROUND_ELEVATION);
            double current = table.getDouble(id, GROUND_FLOOR_HEIGHT);
            double required = ref + heights.get(id) - elevation;
            flht.put(id, Math.max(current, required));
        }
        added.getQualityLog().warn(STEP, "NO_REFERENCE_LEVEL", withoutReference,
                "New development area without a reference level keeps ground_flht 0");
        return added.withTable(table.withValues(GROUND_FLOOR_HEIGHT, flht));
    }

    private double heightOf(Feature polygon, CompositeGrowthSpec spec) {
        Object raw = polygon.getProperty(spec.getHeightAttribute());
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw != null && !raw.toString().isBlank()) {
            try {
                return Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("⚠️ Height '{}' of development area {} is not a number, using {}", raw, polygon.getId(),
                        spec.getGroundFloorHeight());
            }
        }
        return spec.getGroundFloorHeight();
    }
}
