package com.ogt.exposure.model;

import lombok.Value;

/**
 * Polygon layer used to label assets; the label is read from {@code attribute}.
 */
@Value
public class AggregationArea {
    String source;
    String attribute;
}
