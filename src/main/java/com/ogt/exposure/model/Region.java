package com.ogt.exposure.model;

import lombok.Value;
import org.locationtech.jts.geom.Envelope;

/**
 * Bounding box of interest, in its own CRS. Providers use it to skip features that cannot
 * take part in a join.
 */
@Value
public class Region {

    Envelope envelope;
    Crs crs;

    /** Bounds of the layer grown by {@code margin} map units. */
    public static Region around(FeatureLayer layer, double margin) {
        Envelope env = new Envelope(layer.getBounds());
        if (!env.isNull()) {
            env.expandBy(margin);
        }
        return new Region(env, layer.getCrs());
    }
}
