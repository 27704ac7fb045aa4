package com.ogt.exposure.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * One geometry of a layer plus its attributes. For exposure layers the id is the object_id.
 */
@Value
@Builder(toBuilder = true)
public class Feature {

    long id;

    @With
    Geometry geometry;

    @Builder.Default
    Map<String, Object> properties = Collections.emptyMap();

    public static Feature of(long id, Geometry geometry) {
        return new Feature(id, geometry, Collections.emptyMap());
    }

    public static Feature of(long id, Geometry geometry, Map<String, Object> properties) {
        // HashMap: source attributes may be null
        return new Feature(id, geometry, Collections.unmodifiableMap(new HashMap<>(properties)));
    }

    public Object getProperty(String name) {
        return properties.get(name);
    }

    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }
}
