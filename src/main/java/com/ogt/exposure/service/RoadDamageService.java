package com.ogt.exposure.service;

import com.ogt.exposure.config.ExposureProperties;
import com.ogt.exposure.io.TabularDataProvider;
import com.ogt.exposure.model.DataTable;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureColumns;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.ExtractionMethod;
import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.RoadDamageSource;
import com.ogt.exposure.model.UnitSystem;
import com.ogt.exposure.util.DataQualityLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Lineal;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.exposure.model.ExposureColumns.EXTRACTION_METHOD;
import static com.ogt.exposure.model.ExposureColumns.LANES;
import static com.ogt.exposure.model.ExposureColumns.OBJECT_ID;
import static com.ogt.exposure.model.ExposureColumns.OBJECT_NAME;
import static com.ogt.exposure.model.ExposureColumns.PRIMARY_OBJECT_TYPE;
import static com.ogt.exposure.model.ExposureColumns.SECONDARY_OBJECT_TYPE;
import static com.ogt.exposure.model.ExposureColumns.SEGMENT_LENGTH;

/**
 * Road segments as exposure assets: length, lanes and a structure damage value per segment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoadDamageService {

    static final String STEP = "roads";
    public static final String ROAD = "road";
    public static final String HIGHWAY_ATTRIBUTE = "highway";
    public static final String LANES_ATTRIBUTE = "lanes";
    public static final String NAME_ATTRIBUTE = "name";
    public static final String STRUCTURE = "structure";

    private final ExposureProperties properties;
    private final CoordinateService coordinateService;
    private final TabularDataProvider tabularProvider;

    /**
     * Road assets numbered from {@code firstId}. Features that are not lines are skipped.
     */
    public Exposure buildRoads(FeatureLayer roads, RoadDamageSource damage, long firstId, DataQualityLog qualityLog) {
        // 1. Lines only
        List<Feature> lines = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        for (Feature f : roads.getFeatures()) {
            if (f.getGeometry() instanceof Lineal && !f.getGeometry().isEmpty()) {
                lines.add(f);
            } else {
                skipped.add(f.getId());
            }
        }
        qualityLog.warn(STEP, "NOT_A_LINE", skipped, "Road features without a line geometry are skipped");
        FeatureLayer lineLayer = roads.withFeatures(lines);

        // 2. Length always recomputed in a local projected CRS
        Map<Long, Double> lengths = segmentLengths(lineLayer);
        Map<Integer, Double> laneCosts = damage.kind() == RoadDamageSource.Kind.LANE_COST_TABLE
                ? laneCosts((RoadDamageSource.LaneCostTable) damage) : Map.of();

        // 3. One asset per segment
        List<Map<String, Object>> rows = new ArrayList<>();
        List<Feature> features = new ArrayList<>();
        List<Long> unknownLanes = new ArrayList<>();
        long id = firstId;
        for (Feature f : lines) {
            double length = lengths.get(f.getId());
            int lanes = lanesOf(f.getProperty(LANES_ATTRIBUTE));

            Map<String, Object> row = new LinkedHashMap<>();
            row.put(OBJECT_ID, id);
            row.put(OBJECT_NAME, f.getProperty(NAME_ATTRIBUTE));
            row.put(PRIMARY_OBJECT_TYPE, ROAD);
            row.put(SECONDARY_OBJECT_TYPE, f.getProperty(HIGHWAY_ATTRIBUTE));
            row.put(EXTRACTION_METHOD, ExtractionMethod.CENTROID.getCode());
            row.put(SEGMENT_LENGTH, length);
            row.put(LANES, lanes);

            Double maxDamage = switch (damage.kind()) {
                case NONE -> null;
                case CONSTANT -> ((RoadDamageSource.Constant) damage).getValue() * length;
                case LANE_COST_TABLE -> {
                    Double cost = laneCosts.get(lanes);
                    if (cost == null) {
                        unknownLanes.add(id);
                    }
                    yield cost == null ? null : cost * length;
                }
            };
            if (damage.kind() != RoadDamageSource.Kind.NONE) {
                row.put(ExposureColumns.maxDamage(STRUCTURE), maxDamage);
            }
            rows.add(row);
            features.add(Feature.of(id, f.getGeometry(), f.getProperties()));
            id++;
        }
        qualityLog.warn(STEP, "LANE_COUNT_WITHOUT_COST", unknownLanes, "Lane count not in the road cost table");
        log.info("🛣️ {} road segments prepared ({} skipped)", rows.size(), skipped.size());

        FeatureLayer geometries = new FeatureLayer(roads.getName(), roads.getCrs(), features);
        return new Exposure(ExposureTable.fromRows(rows), geometries, null, qualityLog);
    }

    /**
     * Appends road assets to an exposure, with ids above its current maximum.
     */
    public Exposure appendRoads(Exposure exposure, FeatureLayer roads, RoadDamageSource damage) {
        FeatureLayer local = exposure.getGeometries() == null ? roads : coordinateService.harmonize(exposure.getGeometries(), roads);
        Exposure built = buildRoads(local, damage, exposure.getTable().maxObjectId() + 1, exposure.getQualityLog());
        FeatureLayer geometries = exposure.getGeometries() == null
                ? built.getGeometries()
                : exposure.getGeometries().append(built.getGeometries().getFeatures());
        return new Exposure(exposure.getTable().append(built.getTable()), geometries,
                exposure.getCurves(), exposure.getQualityLog());
    }

    /** Metric length per segment, divided by 0.3048 when the model works in feet. */
    private Map<Long, Double> segmentLengths(FeatureLayer lines) {
        Map<Long, Double> metres = coordinateService.lengths(lines, UnitSystem.METERS);
        if (properties.getUnitSystem() != UnitSystem.FEET) {
            return metres;
        }
        Map<Long, Double> feet = new LinkedHashMap<>();
        metres.forEach((id, m) -> feet.put(id, m / UnitSystem.METERS_PER_FOOT));
        return feet;
    }

    private Map<Integer, Double> laneCosts(RoadDamageSource.LaneCostTable source) {
        DataTable table = tabularProvider.read(source.getTable());
        table.requireColumns(source.getLanesColumn(), source.getCostColumn());
        Map<Integer, Double> costs = new HashMap<>();
        for (Map<String, String> row : table.getRows()) {
            Double lanes = DataTable.parseDouble(table.getName(), source.getLanesColumn(), row.get(source.getLanesColumn()));
            Double cost = DataTable.parseDouble(table.getName(), source.getCostColumn(), row.get(source.getCostColumn()));
            if (lanes != null && cost != null) {
                costs.put(lanes.intValue(), cost);
            }
        }
        return costs;
    }

    /** Missing, unreadable or zero lane counts count as one lane. */
    static int lanesOf(Object raw) {
        double lanes = 0;
        if (raw instanceof Number n) {
            lanes = n.doubleValue();
        } else if (raw != null) {
            try {
                lanes = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                lanes = 0;
            }
        }
        return Double.isNaN(lanes) || lanes <= 0 ? 1 : (int) lanes;
    }
}
