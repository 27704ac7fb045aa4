package com.ogt.exposure.model;

import lombok.Builder;
import lombok.Value;

/**
 * North-up regular grid. (originX, originY) is the upper-left corner; values are stored row by
 * row starting at the top row.
 */
@Value
@Builder
public class RasterGrid {

    Crs crs;
    double originX;
    double originY;
    double cellSize;
    int columns;
    int rows;
    double[] values;
    Double nodata;

    /** Null outside the grid, on nodata and on NaN. */
    public Double valueAt(int column, int row) {
        if (column < 0 || row < 0 || column >= columns || row >= rows) {
            return null;
        }
        double v = values[row * columns + column];
        if (Double.isNaN(v) || (nodata != null && v == nodata)) {
            return null;
        }
        return v;
    }

    public Double sample(double x, double y) {
        return valueAt(columnOf(x), rowOf(y));
    }

    public int columnOf(double x) {
        return (int) Math.floor((x - originX) / cellSize);
    }

    public int rowOf(double y) {
        return (int) Math.floor((originY - y) / cellSize);
    }

    public double cellCenterX(int column) {
        return originX + (column + 0.5) * cellSize;
    }

    public double cellCenterY(int row) {
        return originY - (row + 0.5) * cellSize;
    }
}
