package com.ogt.exposure.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collection;

/**
 * Raise the ground floor of selected assets to a required level.
 */
@Value
@Builder
public class RaiseRequest {

    /** Selected assets; null selects every asset. */
    Collection<Long> objectIds;

    double raiseBy;

    @Builder.Default
    HeightReference reference = HeightReference.DATUM;

    /** Reference layer and attribute for {@link HeightReference#GEOM}. */
    LayerJoin referenceLayer;

    /** Table with object_id and {@link #tableAttribute} for {@link HeightReference#TABLE}. */
    String referenceTable;
    String tableAttribute;
}
