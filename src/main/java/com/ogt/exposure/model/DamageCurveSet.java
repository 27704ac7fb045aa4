package com.ogt.exposure.model;

import com.ogt.exposure.exception.MalformedTableException;
import com.ogt.exposure.exception.UserInputException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Companion curve-value table: one ascending depth axis shared by every curve, and per curve id
 * the damage fraction at each depth. Immutable.
 */
public final class DamageCurveSet {

    public static final String DEPTH_COLUMN = "water depth";

    private final double[] depths;
    private final Map<String, double[]> curves;

    private DamageCurveSet(double[] depths, Map<String, double[]> curves) {
        this.depths = depths;
        this.curves = curves;
    }

    public static DamageCurveSet withDepths(double... depths) {
        if (depths.length == 0) {
            throw new UserInputException("A damage curve set needs at least one depth");
        }
        for (int i = 1; i < depths.length; i++) {
            if (depths[i] <= depths[i - 1]) {
                throw new UserInputException("Damage curve depths must be strictly ascending");
            }
        }
        return new DamageCurveSet(depths.clone(), new LinkedHashMap<>());
    }

    /**
     * Reads a wide table: one depth column and one column per curve id.
     */
    public static DamageCurveSet fromDataTable(DataTable table) {
        table.requireColumns(DEPTH_COLUMN);
        double[] depths = new double[table.getRows().size()];
        for (int i = 0; i < depths.length; i++) {
            Double d = DataTable.parseDouble(table.getName(), DEPTH_COLUMN, table.getRows().get(i).get(DEPTH_COLUMN));
            if (d == null) {
                throw new MalformedTableException("Table '" + table.getName() + "' has an empty depth at row " + (i + 1));
            }
            depths[i] = d;
        }
        DamageCurveSet set = withDepths(depths);
        for (String column : table.getColumns()) {
            if (column.equals(DEPTH_COLUMN)) {
                continue;
            }
            double[] fractions = new double[depths.length];
            for (int i = 0; i < depths.length; i++) {
                Double f = DataTable.parseDouble(table.getName(), column, table.getRows().get(i).get(column));
                fractions[i] = f == null ? 0.0 : f;
            }
            set = set.withCurve(column, fractions);
        }
        return set;
    }

    /** Returns a copy holding the given curve, replacing an existing one with the same id. */
    public DamageCurveSet withCurve(String curveId, double[] fractions) {
        if (fractions.length != depths.length) {
            throw new UserInputException(String.format("Curve '%s' has %d values but the depth axis has %d",
                    curveId, fractions.length, depths.length));
        }
        Map<String, double[]> copy = new LinkedHashMap<>(curves);
        copy.put(curveId, fractions.clone());
        return new DamageCurveSet(depths, copy);
    }

    public boolean contains(String curveId) {
        return curves.containsKey(curveId);
    }

    public Set<String> getCurveIds() {
        return Collections.unmodifiableSet(curves.keySet());
    }

    public double[] getDepths() {
        return depths.clone();
    }

    public double[] getFractions(String curveId) {
        double[] f = curves.get(curveId);
        if (f == null) {
            throw new UserInputException("Unknown damage curve: " + curveId);
        }
        return f.clone();
    }

    /** Linear interpolation, clamped to the first and last depth. */
    public double fractionAt(String curveId, double depth) {
        double[] f = getFractions(curveId);
        if (depth <= depths[0]) {
            return f[0];
        }
        if (depth >= depths[depths.length - 1]) {
            return f[f.length - 1];
        }
        int i = Arrays.binarySearch(depths, depth);
        if (i >= 0) {
            return f[i];
        }
        int hi = -i - 1;
        int lo = hi - 1;
        double t = (depth - depths[lo]) / (depths[hi] - depths[lo]);
        return f[lo] + t * (f[hi] - f[lo]);
    }

    public int size() {
        return curves.size();
    }
}
