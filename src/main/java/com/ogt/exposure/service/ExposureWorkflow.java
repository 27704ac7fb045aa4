package com.ogt.exposure.service;

import com.ogt.exposure.io.TabularDataProvider;
import com.ogt.exposure.model.AggregationArea;
import com.ogt.exposure.model.CompositeGrowthSpec;
import com.ogt.exposure.model.DamageCurveSet;
import com.ogt.exposure.model.DamageSource;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.ExtractionMethod;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.HeightSource;
import com.ogt.exposure.model.RaiseRequest;
import com.ogt.exposure.model.RoadDamageSource;
import com.ogt.exposure.model.UnclassifiedPolicy;
import com.ogt.exposure.model.VulnerabilityLinkingTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.ogt.exposure.model.ExposureColumns.PRIMARY_OBJECT_TYPE;

/**
 * Builds an exposure model in the fixed order locations, classification, damage,
 * height/elevation, vulnerability linking and then the optional floodproofing and growth steps.
 * Every step fails fast when an earlier one has not run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExposureWorkflow {

    public enum Stage { LOCATIONS, CLASSIFIED, DAMAGE, HEIGHTS, LINKED }

    private final ExposureSetupService setupService;
    private final AggregationAreaService aggregationAreaService;
    private final DamageValueResolver damageValueResolver;
    private final HeightElevationService heightElevationService;
    private final VulnerabilityLinker vulnerabilityLinker;
    private final FloodproofingService floodproofingService;
    private final CompositeAreaService compositeAreaService;
    private final RoadDamageService roadDamageService;
    private final TabularDataProvider tabularProvider;

    public Build start(String assetSource, String idAttribute) {
        return new Build(setupService.setupAssetLocations(assetSource, idAttribute));
    }

    public Build start(FeatureLayer assets, String idAttribute) {
        return new Build(setupService.setupAssetLocations(assets, idAttribute));
    }

    /**
     * One exposure model under construction. Not thread-safe.
     */
    public class Build {

        private Exposure exposure;
        private Stage stage = Stage.LOCATIONS;

        Build(Exposure exposure) {
            this.exposure = exposure;
        }

        public Stage getStage() {
            return stage;
        }

        public Exposure getExposure() {
            return exposure;
        }

        public Build mapAttributes(Map<String, String> columnToAttribute) {
            require("attribute mapping", Stage.LOCATIONS);
            exposure = setupService.mapAttributes(exposure, columnToAttribute);
            if (exposure.getTable().hasColumn(PRIMARY_OBJECT_TYPE)) {
                advance(Stage.CLASSIFIED);
            }
            return this;
        }

        public Build classify(String landUseSource, String primaryAttribute, String secondaryAttribute,
                              UnclassifiedPolicy policy) {
            require("occupancy classification", Stage.LOCATIONS);
            exposure = setupService.setupOccupancy(exposure, landUseSource, primaryAttribute, secondaryAttribute, policy);
            advance(Stage.CLASSIFIED);
            return this;
        }

        public Build extractionMethod(ExtractionMethod method) {
            require("extraction method", Stage.LOCATIONS);
            exposure = setupService.setupExtractionMethod(exposure, method);
            return this;
        }

        public Build aggregationAreas(Map<String, AggregationArea> areas) {
            require("aggregation areas", Stage.LOCATIONS);
            exposure = aggregationAreaService.assign(exposure, areas);
            return this;
        }

        public Build roads(FeatureLayer roads, RoadDamageSource damage) {
            require("roads", Stage.LOCATIONS);
            exposure = roadDamageService.appendRoads(exposure, roads, damage);
            return this;
        }

        public Build maxPotentialDamage(DamageSource source, List<String> damageTypes) {
            require("max potential damage", Stage.CLASSIFIED);
            exposure = damageValueResolver.resolve(exposure, source, damageTypes);
            advance(Stage.DAMAGE);
            return this;
        }

        public Build updateMaxPotentialDamage(String source) {
            require("max potential damage update", Stage.DAMAGE);
            exposure = setupService.updateMaxPotentialDamage(exposure, tabularProvider.read(source));
            return this;
        }

        public Build groundFloorHeight(HeightSource source) {
            require("ground floor height", Stage.DAMAGE);
            exposure = heightElevationService.setGroundFloorHeight(exposure, source);
            advance(Stage.HEIGHTS);
            return this;
        }

        public Build groundElevation(HeightSource source) {
            require("ground elevation", Stage.DAMAGE);
            exposure = heightElevationService.setGroundElevation(exposure, source);
            return this;
        }

        public Build raiseGroundFloorHeight(RaiseRequest request) {
            require("raise ground floor height", Stage.HEIGHTS);
            exposure = heightElevationService.raiseGroundFloorHeight(exposure, request);
            return this;
        }

        public Build linkVulnerability(String linkingSource, String curvesSource) {
            return linkVulnerability(VulnerabilityLinkingTable.fromDataTable(tabularProvider.read(linkingSource)),
                    DamageCurveSet.fromDataTable(tabularProvider.read(curvesSource)));
        }

        public Build linkVulnerability(VulnerabilityLinkingTable linking, DamageCurveSet curves) {
            require("vulnerability linking", Stage.HEIGHTS);
            exposure = vulnerabilityLinker.link(exposure.withCurves(curves), linking);
            advance(Stage.LINKED);
            return this;
        }

        public Build floodproof(Collection<Long> objectIds, double floodproofTo, List<String> damageTypes) {
            require("floodproofing", Stage.LINKED);
            exposure = floodproofingService.floodproof(exposure, objectIds, floodproofTo, damageTypes);
            return this;
        }

        public Build addCompositeAreas(CompositeGrowthSpec spec) {
            require("new composite areas", Stage.LINKED);
            exposure = compositeAreaService.addCompositeAreas(exposure, spec);
            return this;
        }

        public Exposure build() {
            log.info("✅ Exposure model built: {} assets, stage {}", exposure.getTable().size(), stage);
            if (exposure.getQualityLog().hasIssues()) {
                log.warn("⚠️ Data quality summary:\n{}", exposure.getQualityLog().getSummary());
            }
            return exposure;
        }

        private void require(String step, Stage needed) {
            if (stage.ordinal() < needed.ordinal()) {
                throw new IllegalStateException(String.format(
                        "Step '%s' needs stage %s but the model is at %s", step, needed, stage));
            }
        }

        private void advance(Stage reached) {
            if (reached.ordinal() > stage.ordinal()) {
                stage = reached;
            }
        }
    }
}
