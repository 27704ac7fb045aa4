package com.ogt.exposure.service;

import com.ogt.exposure.config.ExposureProperties;
import com.ogt.exposure.config.ExposureProperties.JrcAdjustment;
import com.ogt.exposure.exception.MalformedTableException;
import com.ogt.exposure.model.DamageValueTable;
import com.ogt.exposure.model.DataTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns cost tables (JRC, hazus, translation tables) into unit damage values per object type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DamageCatalogService {

    public static final String JRC_COUNTRY = "Country";
    public static final String STRUCTURE = "structure";
    public static final String CONTENT = "content";
    public static final String TOTAL = "total";

    public static final String HAZUS_OBJECT_TYPE = "object_type";
    public static final String HAZUS_STRUCTURE = "structure";
    public static final String HAZUS_CONTENT_PERCENT = "content_damage_percent";

    /** JRC building category -> construction cost column of the JRC table. */
    static final Map<String, String> JRC_COST_COLUMNS = new LinkedHashMap<>();

    static {
        JRC_COST_COLUMNS.put("residential", "Construction Cost Residential (2010 €)");
        JRC_COST_COLUMNS.put("commercial", "Construction Cost Commercial (2010 €)");
        JRC_COST_COLUMNS.put("industrial", "Construction Cost Industrial (2010 €)");
    }

    private final ExposureProperties properties;

    /**
     * Adjusted JRC values for one country: structure, content and total per building category,
     * per unit area.
     */
    public DamageValueTable jrc(DataTable table, String country, boolean convertToUsd) {
        table.requireColumns(JRC_COUNTRY);

        // 1. Country row, falling back to the configured default
        String requested = country == null || country.isBlank() ? properties.getDefaultCountry() : country;
        Map<String, String> row = findCountry(table, requested);
        if (row == null && !requested.equalsIgnoreCase(properties.getDefaultCountry())) {
            log.warn("⚠️ Country '{}' not found in '{}', using '{}' values", requested, table.getName(),
                    properties.getDefaultCountry());
            row = findCountry(table, properties.getDefaultCountry());
        }
        if (row == null) {
            throw new MalformedTableException("Table '" + table.getName() + "' has no row for country '"
                    + requested + "' nor for '" + properties.getDefaultCountry() + "'");
        }

        // 2. Adjust the base construction cost per category
        double currency = convertToUsd ? properties.getEur2010ToUsd() : 1.0;
        DamageValueTable values = new DamageValueTable();
        for (Map.Entry<String, String> e : JRC_COST_COLUMNS.entrySet()) {
            String category = e.getKey();
            String column = table.hasColumn(e.getValue()) ? e.getValue() : category;
            table.requireColumns(column);
            Double base = DataTable.parseDouble(table.getName(), column, row.get(column));
            if (base == null) {
                log.warn("⚠️ No JRC construction cost for '{}' in '{}'", category, table.getName());
                continue;
            }
            JrcAdjustment adj = properties.getJrc().getOrDefault(category, new JrcAdjustment());
            double structure = base * adj.getCostVsDepreciated() * (1 - adj.getUndamageablePart())
                    * adj.getMaterialUsed() * currency;
            double content = structure * adj.getContentInventory();
            values.put(category, STRUCTURE, structure)
                    .put(category, CONTENT, content)
                    .put(category, TOTAL, structure + content);
        }
        log.info("✅ JRC damage values for '{}' ({}): {}", requested, convertToUsd ? "USD" : "EUR 2010", values);
        return values;
    }

    /**
     * Hazus replacement values: structure per occupancy and content as a percentage of it.
     */
    public DamageValueTable hazus(DataTable table) {
        table.requireColumns(HAZUS_OBJECT_TYPE, HAZUS_STRUCTURE, HAZUS_CONTENT_PERCENT);
        DamageValueTable values = new DamageValueTable();
        for (Map<String, String> row : table.getRows()) {
            String type = row.get(HAZUS_OBJECT_TYPE);
            Double structure = DataTable.parseDouble(table.getName(), HAZUS_STRUCTURE, row.get(HAZUS_STRUCTURE));
            if (type == null || type.isBlank() || structure == null) {
                continue;
            }
            values.put(type.trim(), STRUCTURE, structure);
            Double percent = DataTable.parseDouble(table.getName(), HAZUS_CONTENT_PERCENT, row.get(HAZUS_CONTENT_PERCENT));
            if (percent != null) {
                values.put(type.trim(), CONTENT, structure * percent / 100.0);
            }
        }
        log.info("✅ Hazus damage values loaded for {} occupancy types", values.getObjectTypes().size());
        return values;
    }

    /**
     * The same value per object type for every requested damage type.
     */
    public DamageValueTable translation(DataTable table, String objectTypeColumn, String valueColumn,
                                        List<String> damageTypes) {
        table.requireColumns(objectTypeColumn, valueColumn);
        DamageValueTable values = new DamageValueTable();
        for (Map<String, String> row : table.getRows()) {
            String type = row.get(objectTypeColumn);
            Double value = DataTable.parseDouble(table.getName(), valueColumn, row.get(valueColumn));
            if (type == null || type.isBlank() || value == null) {
                continue;
            }
            for (String damageType : damageTypes) {
                values.put(type.trim(), damageType, value);
            }
        }
        return values;
    }

    private Map<String, String> findCountry(DataTable table, String country) {
        return table.getRows().stream()
                .filter(r -> r.get(JRC_COUNTRY) != null && r.get(JRC_COUNTRY).trim().equalsIgnoreCase(country.trim()))
                .findFirst()
                .orElse(null);
    }
}
