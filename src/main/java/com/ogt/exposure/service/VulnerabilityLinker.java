package com.ogt.exposure.service;

import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureColumns;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.VulnerabilityLinkingTable;
import com.ogt.exposure.util.ObjectTypeMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ogt.exposure.model.ExposureColumns.PRIMARY_OBJECT_TYPE;

/**
 * Sets {@code fn_damage_<type>} per asset from the object type to curve links.
 */
@Service
@Slf4j
public class VulnerabilityLinker {

    static final String STEP = "vulnerability linking";

    public Exposure link(Exposure exposure, VulnerabilityLinkingTable linking) {
        ExposureTable table = exposure.getTable();
        table.requireColumns(STEP, PRIMARY_OBJECT_TYPE);

        ExposureTable result = table;
        for (String damageType : linking.getDamageTypes()) {
            Map<String, String> curves = linking.forDamageType(damageType);
            String typeColumn = ObjectTypeMatcher.chooseColumn(table, curves.keySet());

            Map<Long, Object> column = new LinkedHashMap<>();
            List<Long> unmatched = new ArrayList<>();
            Set<String> missingTypes = new LinkedHashSet<>();
            for (Long id : table.getObjectIds()) {
                String objectType = table.getString(id, typeColumn);
                String curve = objectType == null ? null : curves.get(objectType);
                column.put(id, curve);
                if (curve == null) {
                    unmatched.add(id);
                    missingTypes.add(String.valueOf(objectType));
                }
            }
            result = result.withValues(ExposureColumns.damageFunction(damageType), column);

            exposure.getQualityLog().warn(STEP, "NO_DAMAGE_FUNCTION", unmatched,
                    "No '" + damageType + "' damage function linked to " + typeColumn + " values " + missingTypes);
            log.info("🔗 Linked '{}' damage functions on {} for {}/{} assets",
                    damageType, typeColumn, table.size() - unmatched.size(), table.size());
        }
        return exposure.withTable(result);
    }
}
