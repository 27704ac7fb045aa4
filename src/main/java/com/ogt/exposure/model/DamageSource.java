package com.ogt.exposure.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Where maximum potential damage values come from. Exactly one kind is used per resolution.
 */
public interface DamageSource {

    enum Kind { CONSTANT, FILE, STANDARD_CATALOG, TRANSLATION_TABLE }

    enum Catalog { JRC, HAZUS }

    Kind kind();

    static DamageSource constant(double value) {
        return new Constant(value);
    }

    /** One reference layer per damage type, processed in map order. */
    static DamageSource fromFiles(Map<String, LayerJoin> joinsByDamageType) {
        return new FileSource(Collections.unmodifiableMap(new LinkedHashMap<>(joinsByDamageType)));
    }

    static DamageSource jrc(String table, String country, boolean convertToUsd) {
        return new StandardCatalog(Catalog.JRC, table, country, convertToUsd);
    }

    static DamageSource hazus(String table) {
        return new StandardCatalog(Catalog.HAZUS, table, null, false);
    }

    static DamageSource translation(String table, String objectTypeColumn, String valueColumn) {
        return new TranslationTable(table, objectTypeColumn, valueColumn);
    }

    @Value
    class Constant implements DamageSource {
        double value;

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }
    }

    @Value
    class FileSource implements DamageSource {
        Map<String, LayerJoin> joins;

        @Override
        public Kind kind() {
            return Kind.FILE;
        }
    }

    @Value
    class StandardCatalog implements DamageSource {
        Catalog catalog;
        String table;
        String country;
        boolean convertToUsd;

        @Override
        public Kind kind() {
            return Kind.STANDARD_CATALOG;
        }
    }

    @Value
    class TranslationTable implements DamageSource {
        String table;
        String objectTypeColumn;
        String valueColumn;

        @Override
        public Kind kind() {
            return Kind.TRANSLATION_TABLE;
        }
    }
}
