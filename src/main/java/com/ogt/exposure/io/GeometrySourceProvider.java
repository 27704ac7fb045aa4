package com.ogt.exposure.io;

import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.Region;

/**
 * Reads a vector source into a feature layer. Features are numbered 1..n in source order.
 */
public interface GeometrySourceProvider {

    /**
     * @param source path or identifier of the source
     * @param region optional area of interest; null reads everything
     */
    FeatureLayer read(String source, Region region);

    default FeatureLayer read(String source) {
        return read(source, null);
    }
}
