package com.ogt.exposure.service;

import com.ogt.exposure.config.ExposureProperties;
import com.ogt.exposure.exception.CrsMissingException;
import com.ogt.exposure.exception.DamageTableRequiredException;
import com.ogt.exposure.exception.ExposureException;
import com.ogt.exposure.exception.JoinMethodUnsupportedException;
import com.ogt.exposure.exception.UserInputException;
import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.io.TabularDataProvider;
import com.ogt.exposure.model.DamageSource;
import com.ogt.exposure.model.DamageValueTable;
import com.ogt.exposure.model.DataTable;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExposureColumns;
import com.ogt.exposure.model.ExposureTable;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.LayerJoin;
import com.ogt.exposure.model.Region;
import com.ogt.exposure.util.ObjectTypeMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ogt.exposure.model.ExposureColumns.PRIMARY_OBJECT_TYPE;

/**
 * Fills {@code max_damage_<type>} columns from one damage source.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DamageValueResolver {

    static final String STEP = "max potential damage";

    private final ExposureProperties properties;
    private final CoordinateService coordinateService;
    private final SpatialJoinService spatialJoinService;
    private final AttributeMerger attributeMerger;
    private final DamageCatalogService catalogService;
    private final GeometrySourceProvider geometryProvider;
    private final TabularDataProvider tabularProvider;

    public Exposure resolve(Exposure exposure, DamageSource source, List<String> damageTypes) {
        log.info("💰 Setting max potential damage for {} ({})", damageTypes, source.kind());
        return switch (source.kind()) {
            case CONSTANT -> fromConstant(exposure, (DamageSource.Constant) source, damageTypes);
            case FILE -> fromFiles(exposure, (DamageSource.FileSource) source);
            case STANDARD_CATALOG -> fromCatalog(exposure, (DamageSource.StandardCatalog) source, damageTypes);
            case TRANSLATION_TABLE -> fromTranslation(exposure, (DamageSource.TranslationTable) source, damageTypes);
        };
    }

    private Exposure fromConstant(Exposure exposure, DamageSource.Constant source, List<String> damageTypes) {
        ExposureTable table = exposure.getTable();
        for (String type : damageTypes) {
            table = table.withConstant(ExposureColumns.maxDamage(type), source.getValue());
        }
        return exposure.withTable(table);
    }

    /**
     * One layer per damage type. A failing type is skipped; structural errors abort the step.
     */
    private Exposure fromFiles(Exposure exposure, DamageSource.FileSource source) {
        requireGeometries(exposure);
        ExposureTable table = exposure.getTable();
        List<String> failed = new ArrayList<>();

        for (Map.Entry<String, LayerJoin> entry : source.getJoins().entrySet()) {
            String type = entry.getKey();
            LayerJoin join = entry.getValue();
            try {
                double maxDistance = join.getMaxDistance() != null ? join.getMaxDistance() : properties.getDefaultMaxDistance();
                FeatureLayer reference = geometryProvider.read(join.getSource(), Region.around(exposure.getGeometries(), maxDistance));
                JoinResult result = spatialJoinService.join(exposure.getGeometries(), reference, join.getAttribute(),
                        join.getMethod(), maxDistance);
                table = attributeMerger.merge(table, ExposureColumns.maxDamage(type), numeric(result.getValues()));
                exposure.getQualityLog().warn(STEP, "NO_DAMAGE_VALUE_IN_REACH", result.getUnmatched(),
                        "No '" + join.getAttribute() + "' value from '" + join.getSource() + "' for damage type '" + type + "'");
            } catch (CrsMissingException | JoinMethodUnsupportedException e) {
                throw e;
            } catch (ExposureException | UncheckedIOException e) {
                log.error("❌ Damage type '{}' skipped, source '{}' failed: {}", type, join.getSource(), e.getMessage());
                failed.add(type);
            }
        }
        exposure.getQualityLog().warn(STEP, "DAMAGE_SOURCE_FAILED", failed, "Damage types left unset because their source failed");
        return exposure.withTable(table);
    }

    private Exposure fromCatalog(Exposure exposure, DamageSource.StandardCatalog source, List<String> damageTypes) {
        if (source.getTable() == null || source.getTable().isBlank()) {
            throw new DamageTableRequiredException(source.getCatalog().name().toLowerCase());
        }
        DataTable data = tabularProvider.read(source.getTable());
        DamageValueTable values = switch (source.getCatalog()) {
            case JRC -> catalogService.jrc(data, source.getCountry(), source.isConvertToUsd());
            case HAZUS -> catalogService.hazus(data);
        };
        return applyUnitValues(exposure, values, damageTypes);
    }

    private Exposure fromTranslation(Exposure exposure, DamageSource.TranslationTable source, List<String> damageTypes) {
        if (source.getTable() == null || source.getTable().isBlank()) {
            throw new DamageTableRequiredException("translation");
        }
        DataTable data = tabularProvider.read(source.getTable());
        DamageValueTable values = catalogService.translation(data, source.getObjectTypeColumn(),
                source.getValueColumn(), damageTypes);
        return applyUnitValues(exposure, values, damageTypes);
    }

    /**
     * Unit value of the asset's object type multiplied by its footprint area. Assets whose type has
     * no unit value keep what an earlier step set.
     */
    Exposure applyUnitValues(Exposure exposure, DamageValueTable values, List<String> damageTypes) {
        requireGeometries(exposure);
        ExposureTable table = exposure.getTable();
        table.requireColumns(STEP, PRIMARY_OBJECT_TYPE);

        String typeColumn = ObjectTypeMatcher.chooseColumn(table, values.getObjectTypes());
        Map<Long, Double> areas = coordinateService.areas(exposure.getGeometries(), properties.getUnitSystem());

        Set<String> missingTypes = new LinkedHashSet<>();
        Set<Long> missingIds = new LinkedHashSet<>();
        ExposureTable result = table;
        for (String damageType : damageTypes) {
            Map<Long, Object> column = new LinkedHashMap<>();
            for (Long id : table.getObjectIds()) {
                String objectType = table.getString(id, typeColumn);
                Double unitValue = objectType == null ? null : values.getValue(objectType, damageType);
                if (unitValue == null) {
                    column.put(id, null);
                    if (objectType != null) {
                        missingTypes.add(objectType);
                    }
                    missingIds.add(id);
                    continue;
                }
                column.put(id, unitValue * areas.getOrDefault(id, 0.0));
            }
            result = attributeMerger.merge(result, ExposureColumns.maxDamage(damageType), column);
        }

        exposure.getQualityLog().warn(STEP, "OBJECT_TYPE_WITHOUT_DAMAGE_VALUE", missingIds,
                "No damage value for object types " + missingTypes + " (column " + typeColumn + ")");
        return exposure.withTable(result);
    }

    private Map<Long, Object> numeric(Map<Long, Object> values) {
        Map<Long, Object> converted = new LinkedHashMap<>();
        values.forEach((id, v) -> converted.put(id, v == null ? null : toDouble(v)));
        return converted;
    }

    private Double toDouble(Object v) {
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new UserInputException("Damage value '" + v + "' is not a number", e);
        }
    }

    private void requireGeometries(Exposure exposure) {
        if (exposure.getGeometries() == null) {
            throw new IllegalStateException("Asset geometries are required to set max potential damage; set up asset locations first");
        }
    }
}
