package com.ogt.exposure.model;

/**
 * Column names of the exposure table.
 */
public final class ExposureColumns {

    public static final String OBJECT_ID = "object_id";
    public static final String OBJECT_NAME = "object_name";
    public static final String PRIMARY_OBJECT_TYPE = "primary_object_type";
    public static final String SECONDARY_OBJECT_TYPE = "secondary_object_type";
    public static final String GROUND_FLOOR_HEIGHT = "ground_flht";
    public static final String GROUND_ELEVATION = "ground_elevtn";
    public static final String EXTRACTION_METHOD = "extract_method";
    public static final String SEGMENT_LENGTH = "segment_length";
    public static final String LANES = "lanes";

    public static final String MAX_DAMAGE_PREFIX = "max_damage_";
    public static final String DAMAGE_FUNCTION_PREFIX = "fn_damage_";
    public static final String AGGREGATION_LABEL_PREFIX = "aggregation_label_";

    private ExposureColumns() {}

    public static String maxDamage(String damageType) {
        return MAX_DAMAGE_PREFIX + damageType;
    }

    public static String damageFunction(String damageType) {
        return DAMAGE_FUNCTION_PREFIX + damageType;
    }

    public static String aggregationLabel(String name) {
        return AGGREGATION_LABEL_PREFIX + name;
    }
}
