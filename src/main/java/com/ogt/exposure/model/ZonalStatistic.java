package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;

import java.util.Arrays;
import java.util.Locale;

public enum ZonalStatistic {
    MEAN,
    MIN,
    MAX,
    MEDIAN;

    /** Returns null for an empty sample. */
    public Double apply(double[] values) {
        if (values.length == 0) {
            return null;
        }
        return switch (this) {
            case MEAN -> Arrays.stream(values).average().orElseThrow();
            case MIN -> Arrays.stream(values).min().orElseThrow();
            case MAX -> Arrays.stream(values).max().orElseThrow();
            case MEDIAN -> {
                double[] sorted = values.clone();
                Arrays.sort(sorted);
                int mid = sorted.length / 2;
                yield sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
            }
        };
    }

    public static ZonalStatistic fromString(String value) {
        if (value == null) {
            return MEAN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UserInputException("Unknown zonal statistic: " + value, e);
        }
    }
}
