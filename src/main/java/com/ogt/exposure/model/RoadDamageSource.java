package com.ogt.exposure.model;

import lombok.Value;

public interface RoadDamageSource {

    enum Kind { NONE, CONSTANT, LANE_COST_TABLE }

    Kind kind();

    static RoadDamageSource none() {
        return new None();
    }

    static RoadDamageSource constant(double value) {
        return new Constant(value);
    }

    static RoadDamageSource laneCostTable(String table, String lanesColumn, String costColumn) {
        return new LaneCostTable(table, lanesColumn, costColumn);
    }

    @Value
    class None implements RoadDamageSource {
        @Override
        public Kind kind() {
            return Kind.NONE;
        }
    }

    @Value
    class Constant implements RoadDamageSource {
        double value;

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }
    }

    /** Cost per length unit by number of lanes. */
    @Value
    class LaneCostTable implements RoadDamageSource {
        String table;
        String lanesColumn;
        String costColumn;

        @Override
        public Kind kind() {
            return Kind.LANE_COST_TABLE;
        }
    }
}
