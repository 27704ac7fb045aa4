package com.ogt.exposure.service;

import com.ogt.exposure.config.ExposureProperties;
import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.model.DataTable;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.ExtractionMethod;
import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.Region;
import com.ogt.exposure.model.UnclassifiedPolicy;
import com.ogt.exposure.util.DataQualityLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ogt.exposure.model.ExposureColumns.EXTRACTION_METHOD;
import static com.ogt.exposure.model.ExposureColumns.MAX_DAMAGE_PREFIX;
import static com.ogt.exposure.model.ExposureColumns.OBJECT_ID;
import static com.ogt.exposure.model.ExposureColumns.PRIMARY_OBJECT_TYPE;
import static com.ogt.exposure.model.ExposureColumns.SECONDARY_OBJECT_TYPE;

/**
 * First steps of an exposure model: asset locations and ids, source attributes, occupancy
 * classification, extraction method and partial max damage updates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExposureSetupService {

    static final String STEP = "asset setup";

    private final ExposureProperties properties;
    private final GeometryNormalizer geometryNormalizer;
    private final SpatialJoinService spatialJoinService;
    private final AttributeMerger attributeMerger;
    private final GeometrySourceProvider geometryProvider;

    public Exposure setupAssetLocations(String source, String idAttribute) {
        return setupAssetLocations(geometryProvider.read(source), idAttribute);
    }

    /**
     * One asset per feature. Ids come from {@code idAttribute} when every feature has a unique
     * integer value there, otherwise the assets are numbered 1..n.
     */
    public Exposure setupAssetLocations(FeatureLayer layer, String idAttribute) {
        coordinateCheck(layer);
        DataQualityLog qualityLog = new DataQualityLog();
        FeatureLayer normalized = geometryNormalizer.normalize(layer, qualityLog);

        // 1. Object ids
        List<Long> ids = idsFromAttribute(normalized, idAttribute, qualityLog);

        // 2. Table and geometries paired on object_id
        List<Map<String, Object>> rows = new ArrayList<>();
        List<Feature> features = new ArrayList<>();
        for (int i = 0; i < normalized.size(); i++) {
            Feature f = normalized.getFeatures().get(i);
            long id = ids.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(OBJECT_ID, id);
            rows.add(row);
            features.add(Feature.of(id, f.getGeometry(), f.getProperties()));
        }
        log.info("📍 {} asset locations loaded from '{}' ({})", rows.size(), layer.getName(), layer.getCrs());
        return new Exposure(ExposureTable.fromRows(rows), normalized.withFeatures(features), null, qualityLog);
    }

    /**
     * Copies source attributes into exposure columns. Attributes absent from the source are skipped.
     *
     * @param columnToAttribute ordered exposure column -> source attribute
     */
    public Exposure mapAttributes(Exposure exposure, Map<String, String> columnToAttribute) {
        ExposureTable table = exposure.getTable();
        FeatureLayer geometries = exposure.getGeometries();
        for (Map.Entry<String, String> e : columnToAttribute.entrySet()) {
            if (!geometries.hasProperty(e.getValue())) {
                log.warn("⚠️ Attribute '{}' not found in '{}', column '{}' not set", e.getValue(), geometries.getName(), e.getKey());
                continue;
            }
            Map<Long, Object> values = new LinkedHashMap<>();
            geometries.getFeatures().forEach(f -> values.put(f.getId(), f.getProperty(e.getValue())));
            table = attributeMerger.merge(table, e.getKey(), values);
        }
        return exposure.withTable(table);
    }

    /**
     * Occupancy from a land-use layer. Assets left without a primary type are handled by the policy.
     *
     * @param secondaryAttribute optional, null leaves the secondary type untouched
     */
    public Exposure setupOccupancy(Exposure exposure, String landUseSource, String primaryAttribute,
                                   String secondaryAttribute, UnclassifiedPolicy policy) {
        FeatureLayer landUse = geometryProvider.read(landUseSource, Region.around(exposure.getGeometries(), 0));
        ExposureTable table = exposure.getTable();

        table = attributeMerger.merge(table, PRIMARY_OBJECT_TYPE,
                spatialJoinService.joinByLocation(exposure.getGeometries(), landUse, primaryAttribute,
                        exposure.getQualityLog()).getValues());
        if (secondaryAttribute != null) {
            table = attributeMerger.merge(table, SECONDARY_OBJECT_TYPE,
                    spatialJoinService.joinByLocation(exposure.getGeometries(), landUse, secondaryAttribute,
                            exposure.getQualityLog()).getValues());
        }

        List<Long> unclassified = new ArrayList<>();
        for (Long id : table.getObjectIds()) {
            if (table.get(id, PRIMARY_OBJECT_TYPE) == null) {
                unclassified.add(id);
            }
        }
        return applyPolicy(exposure.withTable(table), unclassified, policy);
    }

    Exposure applyPolicy(Exposure exposure, List<Long> unclassified, UnclassifiedPolicy policy) {
        if (unclassified.isEmpty()) {
            return exposure;
        }
        switch (policy) {
            case ASSIGN_DEFAULT -> {
                String type = properties.getUnclassifiedObjectType();
                Map<Long, Object> values = new LinkedHashMap<>();
                unclassified.forEach(id -> values.put(id, type));
                exposure.getQualityLog().warn(STEP, "UNCLASSIFIED_ASSIGNED_DEFAULT", unclassified,
                        "Unclassified assets set to '" + type + "'");
                return exposure.withTable(exposure.getTable().withValues(PRIMARY_OBJECT_TYPE, values));
            }
            case DROP -> {
                Set<Long> drop = new HashSet<>(unclassified);
                List<Long> keep = exposure.getTable().getObjectIds().stream().filter(id -> !drop.contains(id)).toList();
                exposure.getQualityLog().warn(STEP, "UNCLASSIFIED_DROPPED", unclassified, "Unclassified assets removed");
                return exposure.withTableAndGeometries(exposure.getTable().retain(keep), exposure.getGeometries().retain(keep));
            }
            default -> {
                exposure.getQualityLog().warn(STEP, "UNCLASSIFIED", unclassified, "Assets without an occupancy type");
                return exposure;
            }
        }
    }

    /**
     * Explicit method for every asset, or by geometry when null: points sample at the centroid,
     * footprints over their area.
     */
    public Exposure setupExtractionMethod(Exposure exposure, ExtractionMethod method) {
        if (method != null) {
            return exposure.withTable(exposure.getTable().withConstant(EXTRACTION_METHOD, method.getCode()));
        }
        Map<Long, Object> values = new LinkedHashMap<>();
        for (Feature f : exposure.getGeometries().getFeatures()) {
            Geometry g = f.getGeometry();
            values.put(f.getId(), (g instanceof Polygonal ? ExtractionMethod.AREA : ExtractionMethod.CENTROID).getCode());
        }
        return exposure.withTable(exposure.getTable().withValues(EXTRACTION_METHOD, values));
    }

    /**
     * Overwrites max_damage_* values with the non-empty cells of a partial table keyed by object_id.
     */
    public Exposure updateMaxPotentialDamage(Exposure exposure, DataTable updates) {
        if (!updates.hasColumn(OBJECT_ID)) {
            log.warn("⚠️ Max potential damage update skipped: table '{}' has no {} column", updates.getName(), OBJECT_ID);
            return exposure;
        }
        List<String> damageColumns = updates.getColumns().stream().filter(c -> c.startsWith(MAX_DAMAGE_PREFIX)).toList();
        log.info("Updating {} for {} assets", damageColumns, updates.getRows().size());

        ExposureTable table = exposure.getTable();
        for (String column : damageColumns) {
            Map<Long, Object> values = new LinkedHashMap<>();
            for (Map<String, String> row : updates.getRows()) {
                Double id = DataTable.parseDouble(updates.getName(), OBJECT_ID, row.get(OBJECT_ID));
                if (id != null && table.contains(id.longValue())) {
                    values.put(id.longValue(), DataTable.parseDouble(updates.getName(), column, row.get(column)));
                }
            }
            table = attributeMerger.merge(table, column, values);
        }
        return exposure.withTable(table);
    }

    private List<Long> idsFromAttribute(FeatureLayer layer, String idAttribute, DataQualityLog qualityLog) {
        List<Long> ids = new ArrayList<>();
        if (idAttribute != null) {
            Set<Long> seen = new HashSet<>();
            List<Long> duplicates = new ArrayList<>();
            boolean usable = true;
            for (Feature f : layer.getFeatures()) {
                Object raw = f.getProperty(idAttribute);
                if (!(raw instanceof Number n) || n.doubleValue() != Math.rint(n.doubleValue())) {
                    usable = false;
                    break;
                }
                long id = n.longValue();
                if (!seen.add(id)) {
                    duplicates.add(id);
                }
                ids.add(id);
            }
            if (usable && duplicates.isEmpty()) {
                return ids;
            }
            qualityLog.warn(STEP, "DUPLICATE_OR_MISSING_ID", duplicates.isEmpty() ? List.of(idAttribute) : duplicates,
                    "Attribute '" + idAttribute + "' does not hold unique integer ids; assets renumbered 1..n");
            ids.clear();
        }
        for (long i = 1; i <= layer.size(); i++) {
            ids.add(i);
        }
        return ids;
    }

    private void coordinateCheck(FeatureLayer layer) {
        if (layer.getCrs() == null) {
            log.warn("⚠️ Asset layer '{}' has no CRS; joins with other layers will fail", layer.getName());
        }
    }
}
