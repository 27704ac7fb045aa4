package com.ogt.exposure.model;

import com.ogt.exposure.exception.MalformedTableException;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Header plus rows of string cells, as delivered by a tabular provider.
 */
@Value
public class DataTable {

    private static final Pattern COMMA_GROUPED = Pattern.compile("[-+]?\\d{1,3}(,\\d{3})+");

    String name;
    List<String> columns;
    List<Map<String, String>> rows;

    public DataTable(String name, List<String> columns, List<Map<String, String>> rows) {
        this.name = name;
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<Map<String, String>> copy = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public void requireColumns(String... required) {
        for (String column : required) {
            if (!hasColumn(column)) {
                throw new MalformedTableException("Table '" + name + "' has no column '" + column
                        + "'. Available columns: " + columns);
            }
        }
    }

    /**
     * Parses a numeric cell. Blank cells are null; anything else that is not a number is an error.
     * <p>
     * When a cell holds both separators the last one is the decimal mark ("1,064.5" and "1.064,5").
     * A lone comma is a decimal comma ("0,5"), except when it reads as thousands grouping ("1,064"):
     * that cell is ambiguous and rejected.
     */
    public static Double parseDouble(String tableName, String column, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        int comma = value.lastIndexOf(',');
        int dot = value.lastIndexOf('.');
        if (comma >= 0 && dot >= 0) {
            value = comma > dot ? value.replace(".", "").replace(',', '.') : value.replace(",", "");
        } else if (comma >= 0) {
            if (COMMA_GROUPED.matcher(value).matches()) {
                throw new MalformedTableException("Table '" + tableName + "', column '" + column
                        + "': value '" + raw + "' is ambiguous, the comma may group thousands or mark decimals");
            }
            value = value.replace(',', '.');
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new MalformedTableException("Table '" + tableName + "', column '" + column
                    + "': value '" + raw + "' is not a number", e);
        }
    }
}
