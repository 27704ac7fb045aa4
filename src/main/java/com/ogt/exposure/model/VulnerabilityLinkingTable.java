package com.ogt.exposure.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rows of (object_type, damage_type, curve_id).
 */
@Value
public class VulnerabilityLinkingTable {

    public static final String OBJECT_TYPE = "object_type";
    public static final String DAMAGE_TYPE = "damage_type";
    public static final String CURVE_ID = "curve_id";

    List<Link> links;

    @Value
    public static class Link {
        String objectType;
        String damageType;
        String curveId;
    }

    public VulnerabilityLinkingTable(List<Link> links) {
        this.links = Collections.unmodifiableList(new ArrayList<>(links));
    }

    public static VulnerabilityLinkingTable fromDataTable(DataTable table) {
        table.requireColumns(OBJECT_TYPE, DAMAGE_TYPE, CURVE_ID);
        List<Link> links = new ArrayList<>();
        for (Map<String, String> row : table.getRows()) {
            String objectType = row.get(OBJECT_TYPE);
            String damageType = row.get(DAMAGE_TYPE);
            String curveId = row.get(CURVE_ID);
            if (objectType == null || objectType.isBlank() || damageType == null || curveId == null) {
                continue;
            }
            links.add(new Link(objectType.trim(), damageType.trim(), curveId.trim()));
        }
        return new VulnerabilityLinkingTable(links);
    }

    public Set<String> getObjectTypes() {
        Set<String> types = new LinkedHashSet<>();
        links.forEach(l -> types.add(l.getObjectType()));
        return types;
    }

    public Set<String> getDamageTypes() {
        Set<String> types = new LinkedHashSet<>();
        links.forEach(l -> types.add(l.getDamageType()));
        return types;
    }

    /** object_type -> curve_id for one damage type; the first row of a duplicated object type wins. */
    public Map<String, String> forDamageType(String damageType) {
        Map<String, String> map = new LinkedHashMap<>();
        for (Link link : links) {
            if (link.getDamageType().equals(damageType)) {
                map.putIfAbsent(link.getObjectType(), link.getCurveId());
            }
        }
        return map;
    }
}
