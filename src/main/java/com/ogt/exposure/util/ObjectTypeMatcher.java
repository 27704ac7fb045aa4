package com.ogt.exposure.util;

import com.ogt.exposure.model.ExposureTable;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import static com.ogt.exposure.model.ExposureColumns.PRIMARY_OBJECT_TYPE;
import static com.ogt.exposure.model.ExposureColumns.SECONDARY_OBJECT_TYPE;

/**
 * Picks the object-type column (primary or secondary) whose distinct values overlap most with the
 * object types a lookup table knows. Ties go to the primary column.
 */
@Slf4j
public final class ObjectTypeMatcher {

    private ObjectTypeMatcher() {}

    public static String chooseColumn(ExposureTable table, Collection<String> knownTypes) {
        Set<String> known = new HashSet<>(knownTypes);
        int primary = overlap(table, PRIMARY_OBJECT_TYPE, known);
        int secondary = overlap(table, SECONDARY_OBJECT_TYPE, known);
        String column = secondary > primary ? SECONDARY_OBJECT_TYPE : PRIMARY_OBJECT_TYPE;
        log.debug("Object type overlap: primary={}, secondary={} -> {}", primary, secondary, column);
        return column;
    }

    private static int overlap(ExposureTable table, String column, Set<String> known) {
        if (!table.hasColumn(column)) {
            return -1;
        }
        Set<String> values = new HashSet<>(table.distinctValues(column));
        values.retainAll(known);
        return values.size();
    }
}
