package com.ogt.exposure.service;

import com.ogt.exposure.model.ExposureTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Folds freshly joined values into a target column: non-null values overwrite, nulls leave the
 * current value in place. The joined values are not kept in the table.
 */
@Component
@Slf4j
public class AttributeMerger {

    public ExposureTable merge(ExposureTable table, String targetColumn, Map<Long, ?> joined) {
        Map<Long, Object> present = new LinkedHashMap<>();
        joined.forEach((id, value) -> {
            if (value != null) {
                present.put(id, value);
            }
        });
        log.debug("Merging {} of {} joined values into column '{}'", present.size(), joined.size(), targetColumn);
        return table.withValues(targetColumn, present);
    }
}
