package com.ogt.exposure.model;

import lombok.Builder;
import lombok.Value;

/**
 * A file-backed reference layer and how one of its attributes is joined onto the assets.
 * A null max distance falls back to the configured default; a null unit skips unit conversion.
 */
@Value
@Builder
public class LayerJoin {

    String source;
    String attribute;

    @Builder.Default
    JoinMethod method = JoinMethod.INTERSECTION;

    Double maxDistance;
    UnitSystem unit;
}
