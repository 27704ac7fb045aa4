package com.ogt.exposure.service;

import com.ogt.exposure.config.ExposureProperties;
import com.ogt.exposure.exception.UserInputException;
import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.io.RasterProvider;
import com.ogt.exposure.io.TabularDataProvider;
import com.ogt.exposure.model.DataTable;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.HeightSource;
import com.ogt.exposure.model.LayerJoin;
import com.ogt.exposure.model.RaiseRequest;
import com.ogt.exposure.model.RasterGrid;
import com.ogt.exposure.model.Region;
import com.ogt.exposure.model.UnitSystem;
import com.ogt.exposure.model.ZonalStatistic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.exposure.model.ExposureColumns.GROUND_ELEVATION;
import static com.ogt.exposure.model.ExposureColumns.GROUND_FLOOR_HEIGHT;
import static com.ogt.exposure.model.ExposureColumns.OBJECT_ID;

/**
 * Ground floor height and ground elevation of the assets, and raising of ground floors to a
 * required level.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeightElevationService {

    static final String STEP = "ground floor height / elevation";

    private final ExposureProperties properties;
    private final SpatialJoinService spatialJoinService;
    private final AttributeMerger attributeMerger;
    private final ZonalStatisticsService zonalStatisticsService;
    private final GeometrySourceProvider geometryProvider;
    private final TabularDataProvider tabularProvider;
    private final RasterProvider rasterProvider;

    public Exposure setGroundFloorHeight(Exposure exposure, HeightSource source) {
        return assign(exposure, GROUND_FLOOR_HEIGHT, source);
    }

    public Exposure setGroundElevation(Exposure exposure, HeightSource source) {
        return assign(exposure, GROUND_ELEVATION, source);
    }

    private Exposure assign(Exposure exposure, String column, HeightSource source) {
        log.info("📏 Setting {} from {}", column, source.kind());
        return switch (source.kind()) {
            case CONSTANT -> exposure.withTable(
                    exposure.getTable().withConstant(column, ((HeightSource.Constant) source).getValue()));
            case FILE -> exposure.withTable(attributeMerger.merge(exposure.getTable(), column,
                    joinReference(exposure, ((HeightSource.FileSource) source).getJoin(), column)));
            case DEM -> exposure.withTable(attributeMerger.merge(exposure.getTable(), column,
                    sampleDem(exposure, exposure.getGeometries(), (HeightSource.Dem) source)));
            case DEFAULT -> {
                log.warn("⚠️ No source given for {}, every asset gets 0", column);
                yield exposure.withTable(exposure.getTable().withConstant(column, 0.0));
            }
        };
    }

    /**
     * Zonal statistic of a DEM per feature of {@code layer}, converted to the model unit.
     */
    public Map<Long, Double> sampleDem(Exposure exposure, FeatureLayer layer, HeightSource.Dem dem) {
        requireGeometries(layer);
        RasterGrid grid = rasterProvider.read(dem.getSource(), dem.getCrs());
        ZonalStatistic statistic = dem.getStatistic() != null ? dem.getStatistic() : properties.getZonalStatistic();
        ZonalStatisticsService.ZonalResult result = zonalStatisticsService.sample(layer, grid, statistic);

        exposure.getQualityLog().warn(STEP, "ELEVATION_FROM_CENTROID", result.getCentroidFallback(),
                "No DEM cell centre inside the footprint; value sampled at the centroid");
        exposure.getQualityLog().warn(STEP, "ELEVATION_FROM_NEAREST_ASSET", result.getNearestFallback(),
                "No DEM value at the asset; value copied from the nearest asset");
        exposure.getQualityLog().warn(STEP, "ELEVATION_UNRESOLVED", result.getUnresolved(),
                "No DEM value could be found for the asset");

        Map<Long, Double> converted = new LinkedHashMap<>();
        result.getValues().forEach((id, v) -> converted.put(id, v == null ? null : toModelUnit(v, dem.getUnit())));
        return converted;
    }

    /**
     * Raises the ground floor of the selected assets so that ground_flht + ground_elevtn reaches
     * the required level. Ground floors are never lowered.
     */
    public Exposure raiseGroundFloorHeight(Exposure exposure, RaiseRequest request) {
        ExposureTable table = exposure.getTable();
        table.requireColumns("raise ground floor height", GROUND_FLOOR_HEIGHT);

        // 1. Selection
        List<Long> selected = select(table, request.getObjectIds());
        log.info("🏗️ Raising the ground floor of {} assets by {} relative to {}",
                selected.size(), request.getRaiseBy(), request.getReference());

        // 2. Reference level per selected asset
        Map<Long, Double> reference = switch (request.getReference()) {
            case DATUM -> {
                Map<Long, Double> zero = new LinkedHashMap<>();
                selected.forEach(id -> zero.put(id, 0.0));
                yield zero;
            }
            case GEOM -> referenceFromLayer(exposure, selected, request.getReferenceLayer());
            case TABLE -> referenceFromTable(request.getReferenceTable(), request.getTableAttribute());
        };

        // 3. Minimal raise, never lower
        Map<Long, Object> raised = new LinkedHashMap<>();
        List<Long> withoutReference = new ArrayList<>();
        double totalRaise = 0;
        for (Long id : selected) {
            Double ref = reference.get(id);
            if (ref == null) {
                withoutReference.add(id);
                continue;
            }
            double flht = orZero(table.getDouble(id, GROUND_FLOOR_HEIGHT));
            double elevation = orZero(table.getDouble(id, GROUND_ELEVATION));
            double required = ref + request.getRaiseBy();
            if (flht + elevation < required) {
                double newFlht = required - elevation;
                totalRaise += newFlht - flht;
                raised.put(id, newFlht);
            }
        }

        exposure.getQualityLog().warn(STEP, "NO_REFERENCE_LEVEL", withoutReference,
                "Ground floor not raised: no reference level for the asset");
        if (raised.isEmpty()) {
            log.info("✅ No asset was below the required level");
        } else {
            log.info("✅ Raised {} assets, average raise {}", raised.size(), totalRaise / raised.size());
        }
        return exposure.withTable(table.withValues(GROUND_FLOOR_HEIGHT, raised));
    }

    private Map<Long, Object> joinReference(Exposure exposure, LayerJoin join, String column) {
        requireGeometries(exposure.getGeometries());
        double maxDistance = join.getMaxDistance() != null ? join.getMaxDistance() : properties.getDefaultMaxDistance();
        FeatureLayer reference = geometryProvider.read(join.getSource(), Region.around(exposure.getGeometries(), maxDistance));
        JoinResult result = spatialJoinService.join(exposure.getGeometries(), reference, join.getAttribute(),
                join.getMethod(), maxDistance);
        exposure.getQualityLog().warn(STEP, "NO_REFERENCE_VALUE", result.getUnmatched(),
                "No '" + join.getAttribute() + "' from '" + join.getSource() + "' for " + column);

        if (join.getUnit() == null) {
            log.info("No unit given for '{}', values of '{}' used as they are", join.getSource(), join.getAttribute());
        }
        Map<Long, Object> values = new LinkedHashMap<>();
        result.getValues().forEach((id, v) -> {
            Double d = v == null ? null : asDouble(v, join.getAttribute());
            values.put(id, d == null ? null : toModelUnit(d, join.getUnit()));
        });
        return values;
    }

    /**
     * Reference level per selected asset, joined from a reference layer and converted to the model unit.
     */
    public Map<Long, Double> referenceFromLayer(Exposure exposure, List<Long> selected, LayerJoin join) {
        if (join == null) {
            throw new UserInputException("A reference layer is required to raise ground floors relative to 'geom'");
        }
        Exposure subset = exposure.withTableAndGeometries(exposure.getTable().retain(selected),
                exposure.getGeometries().retain(selected));
        Map<Long, Double> values = new LinkedHashMap<>();
        joinReference(subset, join, GROUND_FLOOR_HEIGHT).forEach((id, v) -> values.put(id, (Double) v));
        return values;
    }

    private Map<Long, Double> referenceFromTable(String source, String attribute) {
        if (source == null || attribute == null) {
            throw new UserInputException("A reference table and attribute are required to raise ground floors relative to 'table'");
        }
        DataTable data = tabularProvider.read(source);
        data.requireColumns(OBJECT_ID, attribute);
        Map<Long, Double> values = new LinkedHashMap<>();
        for (Map<String, String> row : data.getRows()) {
            Double id = DataTable.parseDouble(data.getName(), OBJECT_ID, row.get(OBJECT_ID));
            if (id != null) {
                values.put(id.longValue(), DataTable.parseDouble(data.getName(), attribute, row.get(attribute)));
            }
        }
        return values;
    }

    private List<Long> select(ExposureTable table, Collection<Long> objectIds) {
        if (objectIds == null) {
            return table.getObjectIds();
        }
        List<Long> selected = new ArrayList<>();
        List<Long> unknown = new ArrayList<>();
        for (Long id : objectIds) {
            (table.contains(id) ? selected : unknown).add(id);
        }
        if (!unknown.isEmpty()) {
            log.warn("⚠️ {} selected object ids are not in the exposure table: {}", unknown.size(),
                    unknown.subList(0, Math.min(5, unknown.size())));
        }
        return selected;
    }

    private double toModelUnit(double value, UnitSystem sourceUnit) {
        return sourceUnit == null ? value : sourceUnit.convertTo(value, properties.getUnitSystem());
    }

    private Double asDouble(Object v, String attribute) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new UserInputException("Attribute '" + attribute + "' has a non numeric value: " + v, e);
        }
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private void requireGeometries(FeatureLayer layer) {
        if (layer == null) {
            throw new IllegalStateException("Asset geometries are required for " + STEP + "; set up asset locations first");
        }
    }
}
