package com.ogt.exposure.service;

import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.model.AggregationArea;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureColumns;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.Region;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labels assets with the aggregation zone (district, neighbourhood...) they fall in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AggregationAreaService {

    static final String STEP = "aggregation areas";

    private final SpatialJoinService spatialJoinService;
    private final AttributeMerger attributeMerger;
    private final GeometrySourceProvider geometryProvider;

    /**
     * @param areas ordered aggregation name -> zone layer; one {@code aggregation_label_<name>} column each
     */
    public Exposure assign(Exposure exposure, Map<String, AggregationArea> areas) {
        if (exposure.getGeometries() == null) {
            throw new IllegalStateException("Asset geometries are required for " + STEP);
        }
        ExposureTable table = exposure.getTable();
        for (Map.Entry<String, AggregationArea> e : areas.entrySet()) {
            AggregationArea area = e.getValue();
            FeatureLayer zones = geometryProvider.read(area.getSource(), Region.around(exposure.getGeometries(), 0));

            Map<Long, Object> labels = label(exposure, zones, area.getAttribute());
            List<Long> unlabelled = new ArrayList<>();
            labels.forEach((id, v) -> {
                if (v == null) {
                    unlabelled.add(id);
                }
            });
            table = attributeMerger.merge(table, ExposureColumns.aggregationLabel(e.getKey()), labels);
            exposure.getQualityLog().warn(STEP, "OUTSIDE_AGGREGATION_AREA", unlabelled,
                    "Assets outside every zone of aggregation '" + e.getKey() + "'");
            log.info("🗺️ Aggregation '{}': {}/{} assets labelled", e.getKey(), labels.size() - unlabelled.size(), labels.size());
        }
        return exposure.withTable(table);
    }

    private Map<Long, Object> label(Exposure exposure, FeatureLayer zones, String attribute) {
        Map<Long, Object> labels = new LinkedHashMap<>();
        spatialJoinService.joinByLocation(exposure.getGeometries(), zones, attribute, exposure.getQualityLog()).getValues()
                .forEach((id, v) -> labels.put(id, v == null ? null : v.toString()));
        return labels;
    }
}
