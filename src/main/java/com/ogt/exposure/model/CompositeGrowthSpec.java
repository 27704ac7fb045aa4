package com.ogt.exposure.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Hypothetical development areas to add to an exposure model.
 */
@Value
@Builder
public class CompositeGrowthSpec {

    /** Percentage (10 means 10%) of the current total damage given to the new areas. */
    double percentGrowth;

    @Singular
    List<String> damageTypes;

    /** Polygon layer with the development areas. */
    String geometrySource;

    /** Uniform height used when a polygon has no height attribute. */
    double groundFloorHeight;

    @Builder.Default
    String heightAttribute = "height";

    @Builder.Default
    HeightReference elevationReference = HeightReference.DATUM;

    /** Reference layer for {@link HeightReference#GEOM}. */
    LayerJoin heightReferenceLayer;

    /** Optional DEM for the ground elevation of the new areas. */
    HeightSource.Dem groundElevation;

    /** Ordered name -> aggregation layer. */
    @Singular
    Map<String, AggregationArea> aggregationAreas;
}
