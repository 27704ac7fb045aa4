package com.ogt.exposure.model;

import lombok.Value;
import lombok.With;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered collection of features sharing one CRS. Insertion order is meaningful: it breaks
 * ties in spatial joins.
 */
@Value
@With
public class FeatureLayer {

    String name;
    Crs crs;
    List<Feature> features;

    public FeatureLayer(String name, Crs crs, List<Feature> features) {
        this.name = name;
        this.crs = crs;
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
    }

    public static FeatureLayer empty(String name, Crs crs) {
        return new FeatureLayer(name, crs, List.of());
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public List<Long> getIds() {
        return features.stream().map(Feature::getId).toList();
    }

    public Map<Long, Feature> byId() {
        Map<Long, Feature> map = new LinkedHashMap<>();
        for (Feature f : features) {
            map.put(f.getId(), f);
        }
        return map;
    }

    public boolean hasProperty(String name) {
        return features.stream().anyMatch(f -> f.hasProperty(name));
    }

    public Envelope getBounds() {
        Envelope env = new Envelope();
        for (Feature f : features) {
            if (f.getGeometry() != null) {
                env.expandToInclude(f.getGeometry().getEnvelopeInternal());
            }
        }
        return env;
    }

    /** Keeps only the features whose id is in the given collection, in layer order. */
    public FeatureLayer retain(Collection<Long> ids) {
        Set<Long> keep = new HashSet<>(ids);
        return withFeatures(features.stream().filter(f -> keep.contains(f.getId())).toList());
    }

    /** Appends features; duplicate ids are rejected by the exposure table, not here. */
    public FeatureLayer append(List<Feature> more) {
        List<Feature> all = new ArrayList<>(features);
        all.addAll(more);
        return withFeatures(all);
    }
}
