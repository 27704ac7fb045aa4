package com.ogt.exposure.model;

import com.ogt.exposure.exception.UserInputException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.proj.LongLatProjection;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Coordinate reference system identified by an authority code (e.g. "EPSG:4326").
 * Two instances are equal when their normalized codes are equal.
 */
@Getter
@EqualsAndHashCode(of = "code")
public final class Crs {

    private static final CRSFactory FACTORY = new CRSFactory();
    private static final Map<String, Crs> CACHE = new ConcurrentHashMap<>();

    public static final Crs WGS84 = of("EPSG:4326");

    private final String code;
    private final CoordinateReferenceSystem definition;

    private Crs(String code, CoordinateReferenceSystem definition) {
        this.code = code;
        this.definition = definition;
    }

    /**
     * Resolves a CRS from "EPSG:xxxx", "epsg:xxxx" or a bare EPSG number.
     */
    public static Crs of(String code) {
        if (code == null || code.isBlank()) {
            throw new UserInputException("CRS code cannot be empty");
        }
        String normalized = normalize(code);
        return CACHE.computeIfAbsent(normalized, c -> {
            try {
                return new Crs(c, FACTORY.createFromName(c));
            } catch (RuntimeException e) {
                throw new UserInputException("Unknown CRS: " + code, e);
            }
        });
    }

    public static Crs ofEpsg(int epsg) {
        return of("EPSG:" + epsg);
    }

    /**
     * WGS84 / UTM zone, EPSG:326xx in the northern hemisphere and EPSG:327xx in the southern one.
     */
    public static Crs utm(int zone, boolean north) {
        if (zone < 1 || zone > 60) {
            throw new IllegalArgumentException("Invalid UTM zone: " + zone);
        }
        return ofEpsg((north ? 32600 : 32700) + zone);
    }

    public boolean isGeographic() {
        return definition.getProjection() instanceof LongLatProjection;
    }

    /**
     * Whether the linear unit of a projected CRS is the (international or US survey) foot.
     */
    public boolean isFeet() {
        String params = definition.getParameterString();
        return params != null && (params.contains("+units=ft") || params.contains("+units=us-ft"));
    }

    private static String normalize(String code) {
        String trimmed = code.trim().toUpperCase(Locale.ROOT);
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return "EPSG:" + trimmed;
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return code;
    }
}
