package com.ogt.exposure.exception;

/**
 * One side of a spatial combination has no coordinate reference system.
 */
public class CrsMissingException extends ExposureException {

    public CrsMissingException(String layerName) {
        super("Layer '" + layerName + "' has no CRS defined; it cannot be combined with another layer");
    }
}
