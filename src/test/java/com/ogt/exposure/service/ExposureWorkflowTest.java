package com.ogt.exposure.service;

import com.ogt.exposure.io.GeometrySourceProvider;
import com.ogt.exposure.io.RasterProvider;
import com.ogt.exposure.io.TabularDataProvider;
import com.ogt.exposure.model.DamageCurveSet;
import com.ogt.exposure.model.DamageSource;
import com.ogt.exposure.model.Exposure;
import com.ogt.exposure.model.FeatureLayer;
import com.ogt.exposure.model.HeightSource;
import com.ogt.exposure.model.RaiseRequest;
import com.ogt.exposure.model.VulnerabilityLinkingTable;
import com.ogt.exposure.model.VulnerabilityLinkingTable.Link;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.List;
import java.util.Map;

import static com.ogt.exposure.TestLayers.feature;
import static com.ogt.exposure.TestLayers.layer;
import static com.ogt.exposure.TestLayers.square;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
class ExposureWorkflowTest {

    @Autowired
    private ExposureWorkflow workflow;

    @MockBean
    private GeometrySourceProvider geometryProvider;

    @MockBean
    private TabularDataProvider tabularProvider;

    @MockBean
    private RasterProvider rasterProvider;

    private final FeatureLayer buildings = layer("buildings",
            feature(1, square(0, 0, 10), "bid", 101, "type", "residential"),
            feature(2, square(20, 0, 10), "bid", 102, "type", "commercial"));

    private final VulnerabilityLinkingTable linking = new VulnerabilityLinkingTable(List.of(
            new Link("residential", "structure", "AS1"),
            new Link("commercial", "structure", "AS2")));

    private final DamageCurveSet curves = DamageCurveSet.withDepths(0, 1, 2)
            .withCurve("AS1", new double[]{0, 0.5, 1})
            .withCurve("AS2", new double[]{0.1, 0.4, 0.8});

    @Test
    void buildsModelInOrder() {
        Exposure exposure = workflow.start(buildings, "bid")
                .mapAttributes(Map.of("primary_object_type", "type"))
                .maxPotentialDamage(DamageSource.constant(1000.0), List.of("structure"))
                .groundFloorHeight(HeightSource.constant(0.5))
                .groundElevation(HeightSource.constant(1.0))
                .raiseGroundFloorHeight(RaiseRequest.builder().objectIds(List.of(102L)).raiseBy(2.0).build())
                .linkVulnerability(linking, curves)
                .floodproof(List.of(101L), 1.0, List.of("structure"))
                .build();

        assertEquals(1000.0, exposure.getTable().getDouble(101L, "max_damage_structure"));
        assertEquals(0.5, exposure.getTable().getDouble(101L, "ground_flht"));
        assertEquals(1.0, exposure.getTable().getDouble(102L, "ground_flht"), 1e-9);
        assertEquals("AS1_fp_1", exposure.getTable().getString(101L, "fn_damage_structure"));
        assertEquals("AS2", exposure.getTable().getString(102L, "fn_damage_structure"));
    }

    @Test
    void stepsBeforeTheirInputsAreRejected() {
        ExposureWorkflow.Build build = workflow.start(buildings, "bid");

        assertThrows(IllegalStateException.class,
                () -> build.maxPotentialDamage(DamageSource.constant(1.0), List.of("structure")));
        assertThrows(IllegalStateException.class, () -> build.linkVulnerability(linking, curves));
        assertThrows(IllegalStateException.class, () -> build.floodproof(List.of(101L), 1.0, List.of("structure")));
        assertEquals(ExposureWorkflow.Stage.LOCATIONS, build.getStage());
    }

    @Test
    void stageAdvancesWithEachStep() {
        ExposureWorkflow.Build build = workflow.start(buildings, "bid")
                .mapAttributes(Map.of("primary_object_type", "type"));
        assertEquals(ExposureWorkflow.Stage.CLASSIFIED, build.getStage());

        build.maxPotentialDamage(DamageSource.constant(1.0), List.of("structure"));
        assertEquals(ExposureWorkflow.Stage.DAMAGE, build.getStage());

        build.groundFloorHeight(HeightSource.defaultZero());
        assertEquals(ExposureWorkflow.Stage.HEIGHTS, build.getStage());
    }
}
