package com.ogt.exposure.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ogt.exposure.model.Asset;
import com.ogt.exposure.model.DamageCurveSet;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.ogt.exposure.model.ExposureColumns.OBJECT_ID;

/**
 * Writes an exposure model to a directory: {@code exposure.csv}, {@code exposure.geojson} (geometry
 * plus object_id only) and, when present, {@code damage_curves.csv}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExposureCsvWriter {

    private static final int DECIMAL_PRECISION = 8;

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper = new CsvMapper();

    public void write(Exposure exposure, Path directory) {
        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve("exposure.csv"), tableToCsv(exposure.getTable()), StandardCharsets.UTF_8);
            if (exposure.getGeometries() != null) {
                Files.writeString(directory.resolve("exposure.geojson"), layerToGeoJson(exposure.getGeometries()),
                        StandardCharsets.UTF_8);
            }
            if (exposure.getCurves() != null) {
                Files.writeString(directory.resolve("damage_curves.csv"), curvesToCsv(exposure.getCurves()),
                        StandardCharsets.UTF_8);
            }
            log.info("✅ Exposure model written to {} ({} assets)", directory, exposure.getTable().size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write exposure model to " + directory, e);
        }
    }

    public String tableToCsv(ExposureTable table) throws IOException {
        List<String> columns = table.getColumns();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Asset asset : table.getAssets()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : columns) {
                Object value = asset.get(column);
                row.put(column, value == null ? "" : value);
            }
            rows.add(row);
        }
        return csvMapper.writer(schemaOf(columns)).writeValueAsString(rows);
    }

    public String curvesToCsv(DamageCurveSet curves) throws IOException {
        List<String> columns = new ArrayList<>();
        columns.add(DamageCurveSet.DEPTH_COLUMN);
        columns.addAll(curves.getCurveIds());

        double[] depths = curves.getDepths();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < depths.length; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(DamageCurveSet.DEPTH_COLUMN, depths[i]);
            for (String id : curves.getCurveIds()) {
                row.put(id, curves.getFractions(id)[i]);
            }
            rows.add(row);
        }
        return csvMapper.writer(schemaOf(columns)).writeValueAsString(rows);
    }

    public String layerToGeoJson(FeatureLayer layer) throws IOException {
        GeoJsonWriter geoJsonWriter = new GeoJsonWriter(DECIMAL_PRECISION);
        geoJsonWriter.setEncodeCRS(false);

        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", "FeatureCollection");
        if (layer.getCrs() != null) {
            root.putObject("crs").put("type", "name").putObject("properties").put("name", layer.getCrs().getCode());
        }
        ArrayNode features = root.putArray("features");
        for (Feature f : layer.getFeatures()) {
            ObjectNode node = features.addObject();
            node.put("type", "Feature");
            if (f.getGeometry() == null) {
                node.putNull("geometry");
            } else {
                JsonNode geometry = objectMapper.readTree(geoJsonWriter.write(f.getGeometry()));
                node.set("geometry", geometry);
            }
            node.putObject("properties").put(OBJECT_ID, f.getId());
        }
        return objectMapper.writeValueAsString(root);
    }

    private static CsvSchema schemaOf(List<String> columns) {
        CsvSchema.Builder builder = CsvSchema.builder();
        columns.forEach(builder::addColumn);
        return builder.build().withHeader();
    }
}
