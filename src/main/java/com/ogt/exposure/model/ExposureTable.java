package com.ogt.exposure.model;

import com.ogt.exposure.exception.MissingColumnException;
import com.ogt.exposure.exception.UserInputException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import static com.ogt.exposure.model.ExposureColumns.MAX_DAMAGE_PREFIX;
import static com.ogt.exposure.model.ExposureColumns.OBJECT_ID;

/**
 * Asset attribute table keyed by object_id.
 * <p>
 * Instances are immutable: every modifying method returns a new table and leaves the receiver
 * untouched. Row order is the insertion order and object ids are unique.
 */
public final class ExposureTable {

    private final List<String> columns;
    private final Map<Long, Asset> rows;

    private ExposureTable(List<String> columns, Map<Long, Asset> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableMap(rows);
    }

    public static ExposureTable empty() {
        return new ExposureTable(new ArrayList<>(List.of(OBJECT_ID)), new LinkedHashMap<>());
    }

    /**
     * Builds a table from raw rows; every row needs a numeric object_id.
     *
     * @throws UserInputException when an id is missing or repeated
     */
    public static ExposureTable fromRows(List<Map<String, Object>> rawRows) {
        Set<String> cols = new LinkedHashSet<>();
        cols.add(OBJECT_ID);
        Map<Long, Asset> rows = new LinkedHashMap<>();
        for (Map<String, Object> raw : rawRows) {
            Object id = raw.get(OBJECT_ID);
            if (!(id instanceof Number number)) {
                throw new UserInputException("Every exposure row needs a numeric object_id, got: " + id);
            }
            long objectId = number.longValue();
            if (rows.containsKey(objectId)) {
                throw new UserInputException("Duplicate object_id in exposure rows: " + objectId);
            }
            cols.addAll(raw.keySet());
            rows.put(objectId, Asset.of(objectId, raw));
        }
        return new ExposureTable(new ArrayList<>(cols), rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Fails fast when a step runs before the step that produces its input.
     */
    public void requireColumns(String step, String... required) {
        for (String column : required) {
            if (!hasColumn(column)) {
                throw new MissingColumnException(step, column);
            }
        }
    }

    public List<Long> getObjectIds() {
        return new ArrayList<>(rows.keySet());
    }

    public boolean contains(long objectId) {
        return rows.containsKey(objectId);
    }

    public Collection<Asset> getAssets() {
        return rows.values();
    }

    public Asset getAsset(long objectId) {
        return rows.get(objectId);
    }

    public Object get(long objectId, String column) {
        Asset asset = rows.get(objectId);
        return asset == null ? null : asset.get(column);
    }

    public Double getDouble(long objectId, String column) {
        Asset asset = rows.get(objectId);
        return asset == null ? null : asset.getDouble(column);
    }

    public String getString(long objectId, String column) {
        Asset asset = rows.get(objectId);
        return asset == null ? null : asset.getString(column);
    }

    /**
     * Sets the column for the ids present in {@code values} (null values included). The column is
     * created when missing; rows not in the map keep their current value (null for a new column).
     * Ids unknown to the table are ignored.
     */
    public ExposureTable withValues(String column, Map<Long, ?> values) {
        List<String> cols = new ArrayList<>(columns);
        if (!cols.contains(column)) {
            cols.add(column);
        }
        Map<Long, Asset> copy = new LinkedHashMap<>(rows.size());
        for (Map.Entry<Long, Asset> e : rows.entrySet()) {
            Asset asset = e.getValue();
            if (values.containsKey(e.getKey())) {
                asset = asset.with(column, values.get(e.getKey()));
            }
            copy.put(e.getKey(), asset);
        }
        return new ExposureTable(cols, copy);
    }

    /** Sets the same value on every row. */
    public ExposureTable withConstant(String column, Object value) {
        Map<Long, Object> values = new LinkedHashMap<>();
        for (Long id : rows.keySet()) {
            values.put(id, value);
        }
        return withValues(column, values);
    }

    public ExposureTable withoutColumn(String column) {
        if (OBJECT_ID.equals(column)) {
            throw new UserInputException("object_id cannot be dropped");
        }
        if (!hasColumn(column)) {
            return this;
        }
        List<String> cols = new ArrayList<>(columns);
        cols.remove(column);
        Map<Long, Asset> copy = new LinkedHashMap<>(rows.size());
        rows.forEach((id, asset) -> copy.put(id, asset.without(column)));
        return new ExposureTable(cols, copy);
    }

    /**
     * Concatenates two tables. The column set becomes the union of both.
     *
     * @throws UserInputException when an object_id exists in both tables
     */
    public ExposureTable append(ExposureTable other) {
        Set<String> cols = new LinkedHashSet<>(columns);
        cols.addAll(other.columns);
        Map<Long, Asset> copy = new LinkedHashMap<>(rows);
        for (Asset asset : other.getAssets()) {
            if (copy.containsKey(asset.getObjectId())) {
                throw new UserInputException("object_id " + asset.getObjectId() + " already exists in the exposure table");
            }
            copy.put(asset.getObjectId(), asset);
        }
        return new ExposureTable(new ArrayList<>(cols), copy);
    }

    public ExposureTable filter(Predicate<Asset> keep) {
        Map<Long, Asset> copy = new LinkedHashMap<>();
        rows.forEach((id, asset) -> {
            if (keep.test(asset)) {
                copy.put(id, asset);
            }
        });
        return new ExposureTable(new ArrayList<>(columns), copy);
    }

    public ExposureTable retain(Collection<Long> objectIds) {
        Set<Long> ids = new HashSet<>(objectIds);
        return filter(a -> ids.contains(a.getObjectId()));
    }

    /** 0 for an empty table. */
    public long maxObjectId() {
        return rows.keySet().stream().mapToLong(Long::longValue).max().orElse(0L);
    }

    /** Damage types that currently have a max_damage column, in column order. */
    public List<String> getDamageTypes() {
        return columns.stream()
                .filter(c -> c.startsWith(MAX_DAMAGE_PREFIX))
                .map(c -> c.substring(MAX_DAMAGE_PREFIX.length()))
                .toList();
    }

    /** Non-null distinct values of a column rendered as strings, in first-seen order. */
    public Set<String> distinctValues(String column) {
        Set<String> values = new LinkedHashSet<>();
        for (Asset asset : rows.values()) {
            String v = asset.getString(column);
            if (v != null) {
                values.add(v);
            }
        }
        return values;
    }

    /** Occurrence count per non-null value of a column, in first-seen order. */
    public Map<String, Long> valueCounts(String column) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Asset asset : rows.values()) {
            String v = asset.getString(column);
            if (v != null) {
                counts.merge(v, 1L, Long::sum);
            }
        }
        return counts;
    }

    /** Sum of a numeric column, nulls counted as 0. */
    public double sum(String column) {
        double total = 0;
        for (Asset asset : rows.values()) {
            Double v = asset.getDouble(column);
            if (v != null) {
                total += v;
            }
        }
        return total;
    }

    @Override
    public String toString() {
        return "ExposureTable{rows=" + rows.size() + ", columns=" + columns + "}";
    }
}
