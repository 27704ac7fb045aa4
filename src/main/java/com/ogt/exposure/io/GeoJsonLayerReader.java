package com.ogt.exposure.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ogt.exposure.exception.UserInputException;
import com.ogt.exposure.model.Crs;
import com.ogt.exposure.model.Feature;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.Region;
import com.ogt.exposure.service.CoordinateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GeoJSON FeatureCollection files. The CRS comes from the legacy {@code crs} member and defaults
 * to EPSG:4326.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GeoJsonLayerReader implements GeometrySourceProvider {

    private static final Pattern EPSG_CODE = Pattern.compile("(\\d+)$");
    private static final GeometryFactory geometryFactory = new GeometryFactory();

    private final ObjectMapper objectMapper;
    private final CoordinateService coordinateService;

    @Override
    public FeatureLayer read(String source, Region region) {
        Path path = Path.of(source);
        String name = path.getFileName().toString().replaceFirst("\\.(geo)?json$", "");
        try {
            JsonNode root = objectMapper.readTree(Files.newBufferedReader(path));
            FeatureLayer layer = parse(root, name, region);
            log.info("📂 Read {} features from '{}' ({})", layer.size(), source, layer.getCrs());
            return layer;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read GeoJSON file " + source, e);
        }
    }

    public FeatureLayer parse(JsonNode root, String name, Region region) {
        if (!"FeatureCollection".equals(root.path("type").asText())) {
            throw new UserInputException("'" + name + "' is not a GeoJSON FeatureCollection");
        }
        Crs crs = crsOf(root);
        Envelope window = window(region, crs);

        GeoJsonReader reader = new GeoJsonReader(geometryFactory);
        List<Feature> features = new ArrayList<>();
        long id = 0;
        for (JsonNode node : root.path("features")) {
            id++;
            Geometry geometry = geometryOf(reader, node.get("geometry"), name, id);
            if (window != null && geometry != null && !window.intersects(geometry.getEnvelopeInternal())) {
                continue;
            }
            Map<String, Object> properties = node.hasNonNull("properties")
                    ? objectMapper.convertValue(node.get("properties"), new TypeReference<Map<String, Object>>() {})
                    : Map.of();
            features.add(Feature.of(id, geometry, properties));
        }
        return new FeatureLayer(name, crs, features);
    }

    private Geometry geometryOf(GeoJsonReader reader, JsonNode node, String name, long id) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return reader.read(node.toString());
        } catch (ParseException e) {
            throw new UserInputException("Invalid geometry for feature " + id + " of '" + name + "'", e);
        }
    }

    /** Region bounds expressed in the layer CRS; null when there is nothing to filter on. */
    private Envelope window(Region region, Crs layerCrs) {
        if (region == null || region.getEnvelope() == null || region.getEnvelope().isNull()) {
            return null;
        }
        if (region.getCrs() == null || region.getCrs().equals(layerCrs)) {
            return region.getEnvelope();
        }
        Geometry box = geometryFactory.toGeometry(region.getEnvelope());
        return coordinateService.transform(box, region.getCrs(), layerCrs).getEnvelopeInternal();
    }

    static Crs crsOf(JsonNode root) {
        String name = root.path("crs").path("properties").path("name").asText(null);
        if (name == null || name.isBlank() || name.toUpperCase().endsWith("CRS84")) {
            return Crs.WGS84;
        }
        Matcher m = EPSG_CODE.matcher(name.trim());
        if (!m.find()) {
            throw new UserInputException("Unsupported CRS name in GeoJSON: " + name);
        }
        return Crs.ofEpsg(Integer.parseInt(m.group(1)));
    }
}
