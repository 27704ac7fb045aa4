package com.ogt.exposure.service;

import com.ogt.exposure.model.DamageCurveSet;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureColumns;
import com.ogt.exposure.model.ExposureTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Floodproofing: selected assets get a truncated copy of their damage curve that causes no
 * damage below the floodproofing level.
 */
@Service
@Slf4j
public class FloodproofingService {

    static final String STEP = "floodproofing";

    /**
     * @param objectIds assets to floodproof; null selects every asset, ids not in the model are
     *                  reported and ignored
     */
    public Exposure floodproof(Exposure exposure, Collection<Long> objectIds, double floodproofTo, List<String> damageTypes) {
        if (exposure.getCurves() == null) {
            throw new IllegalStateException("Damage curves are required for " + STEP + "; load the vulnerability curves first");
        }
        ExposureTable table = exposure.getTable();
        DamageCurveSet curves = exposure.getCurves();
        String suffix = suffix(floodproofTo);

        Set<Long> selected = new LinkedHashSet<>();
        List<Long> unknownIds = new ArrayList<>();
        for (Long id : objectIds == null ? table.getObjectIds() : objectIds) {
            if (table.contains(id)) {
                selected.add(id);
            } else {
                unknownIds.add(id);
            }
        }
        exposure.getQualityLog().warn(STEP, "UNKNOWN_OBJECT_ID", unknownIds, "Selected ids not in the exposure model");
        log.info("🛡️ Floodproofing {} assets up to {} for {}", selected.size(), floodproofTo, damageTypes);

        for (String damageType : damageTypes) {
            String column = ExposureColumns.damageFunction(damageType);
            table.requireColumns(STEP, column);

            // 1. Distinct curves used by the selection
            Map<String, List<Long>> assetsByCurve = new LinkedHashMap<>();
            for (Long id : selected) {
                String curve = table.getString(id, column);
                if (curve != null) {
                    assetsByCurve.computeIfAbsent(curve, k -> new ArrayList<>()).add(id);
                }
            }

            // 2. One truncated variant per curve, reused when it already exists
            Map<Long, Object> repointed = new LinkedHashMap<>();
            List<Long> unknownCurve = new ArrayList<>();
            for (Map.Entry<String, List<Long>> e : assetsByCurve.entrySet()) {
                String curve = e.getKey();
                if (!curves.contains(curve)) {
                    unknownCurve.addAll(e.getValue());
                    continue;
                }
                String variant = curve + suffix;
                if (!curves.contains(variant)) {
                    curves = curves.withCurve(variant, truncate(curves, curve, floodproofTo));
                    log.debug("Registered damage curve '{}'", variant);
                }
                e.getValue().forEach(id -> repointed.put(id, variant));
            }

            table = table.withValues(column, repointed);
            exposure.getQualityLog().warn(STEP, "UNKNOWN_DAMAGE_FUNCTION", unknownCurve,
                    "Damage function not in the curve set; '" + damageType + "' left unchanged");
        }
        return exposure.withTable(table).withCurves(curves);
    }

    /** Fractions of the curve with 0 at every depth below the floodproofing level. */
    double[] truncate(DamageCurveSet curves, String curveId, double floodproofTo) {
        double[] depths = curves.getDepths();
        double[] fractions = curves.getFractions(curveId);
        for (int i = 0; i < depths.length; i++) {
            if (depths[i] < floodproofTo) {
                fractions[i] = 0.0;
            }
        }
        return fractions;
    }

    /** "_fp_" plus the level without trailing zeros, dots replaced by underscores: 2.0 gives "_fp_2", 1.5 gives "_fp_1_5". */
    static String suffix(double floodproofTo) {
        String value = BigDecimal.valueOf(floodproofTo).stripTrailingZeros().toPlainString();
        return "_fp_" + value.replace(".", "_");
    }
}
