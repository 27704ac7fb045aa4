package com.ogt.exposure.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the exposure table. Immutable; {@link #with(String, Object)} returns a copy.
 */
@Value
public class Asset {

    long objectId;
    Map<String, Object> values;

    private Asset(long objectId, Map<String, Object> values) {
        this.objectId = objectId;
        this.values = values;
    }

    public static Asset of(long objectId, Map<String, Object> values) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(ExposureColumns.OBJECT_ID, objectId);
        return new Asset(objectId, Collections.unmodifiableMap(copy));
    }

    public Object get(String column) {
        return values.get(column);
    }

    public Double getDouble(String column) {
        return toDouble(values.get(column));
    }

    public String getString(String column) {
        Object v = values.get(column);
        return v == null ? null : v.toString();
    }

    public Asset with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new Asset(objectId, Collections.unmodifiableMap(copy));
    }

    Asset without(String column) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(column);
        return new Asset(objectId, Collections.unmodifiableMap(copy));
    }

    static Double toDouble(Object v) {
        if (v == null) {
            return null;
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        String s = v.toString().trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
