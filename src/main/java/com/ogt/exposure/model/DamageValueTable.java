package com.ogt.exposure.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Unit damage values per object type and damage type: per area unit for buildings,
 * per length unit for roads.
 */
@ToString
@EqualsAndHashCode
public final class DamageValueTable {

    private final Map<String, Map<String, Double>> values = new LinkedHashMap<>();

    public DamageValueTable put(String objectType, String damageType, double value) {
        values.computeIfAbsent(objectType, k -> new LinkedHashMap<>()).put(damageType, value);
        return this;
    }

    /** Null when either the object type or the damage type is unknown. */
    public Double getValue(String objectType, String damageType) {
        Map<String, Double> byType = values.get(objectType);
        return byType == null ? null : byType.get(damageType);
    }

    public Set<String> getObjectTypes() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
