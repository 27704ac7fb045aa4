package com.ogt.exposure.model;

/**
 * What to do with assets that got no object type from the land-use join.
 */
public enum UnclassifiedPolicy {
    /** Leave the type null. */
    KEEP_NULL,
    /** Assign the configured default type; changes damage totals, so it is logged with counts. */
    ASSIGN_DEFAULT,
    /** Remove the rows and their geometries. */
    DROP
}
