package com.ogt.exposure.model;

import lombok.Value;

/**
 * Where ground floor height or ground elevation values come from.
 */
public interface HeightSource {

    enum Kind { CONSTANT, FILE, DEM, DEFAULT }

    Kind kind();

    static HeightSource constant(double value) {
        return new Constant(value);
    }

    static HeightSource fromFile(LayerJoin join) {
        return new FileSource(join);
    }

    static HeightSource dem(String source, Crs crs, ZonalStatistic statistic, UnitSystem unit) {
        return new Dem(source, crs, statistic, unit);
    }

    static HeightSource defaultZero() {
        return new Default();
    }

    @Value
    class Constant implements HeightSource {
        double value;

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }
    }

    @Value
    class FileSource implements HeightSource {
        LayerJoin join;

        @Override
        public Kind kind() {
            return Kind.FILE;
        }
    }

    /** Raster layer; a null statistic uses the configured default, a null unit skips conversion. */
    @Value
    class Dem implements HeightSource {
        String source;
        Crs crs;
        ZonalStatistic statistic;
        UnitSystem unit;

        @Override
        public Kind kind() {
            return Kind.DEM;
        }
    }

    @Value
    class Default implements HeightSource {
        @Override
        public Kind kind() {
            return Kind.DEFAULT;
        }
    }
}
