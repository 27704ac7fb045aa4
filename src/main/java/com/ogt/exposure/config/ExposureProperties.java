package com.ogt.exposure.config;

import com.ogt.exposure.model.UnitSystem;
import com.ogt.exposure.model.ZonalStatistic;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model-wide settings, bound from the {@code exposure.*} keys of application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "exposure")
public class ExposureProperties {

    /** Unit of every derived length, area, height and elevation. */
    @NotNull
    private UnitSystem unitSystem = UnitSystem.METERS;

    /** Nearest-join search radius in map units when the caller gives none. */
    @Positive
    private double defaultMaxDistance = 10.0;

    /** Used when a JRC lookup gets no country. */
    @NotBlank
    private String defaultCountry = "World";

    /** Fixed EUR (2010) to USD factor applied on request to JRC values. */
    @Positive
    private double eur2010ToUsd = 1.327;

    @NotNull
    private ZonalStatistic zonalStatistic = ZonalStatistic.MEAN;

    /** Object type given to unclassified assets under the ASSIGN_DEFAULT policy. */
    @NotBlank
    private String unclassifiedObjectType = "residential";

    /** JRC adjustment factors per building category (residential, commercial, industrial). */
    @Valid
    private Map<String, JrcAdjustment> jrc = defaultJrcAdjustments();

    @Data
    public static class JrcAdjustment {
        @Positive
        private double costVsDepreciated = 0.6;
        @Positive
        private double contentInventory = 1.0;
        private double undamageablePart = 0.4;
        @Positive
        private double materialUsed = 1.0;

        public JrcAdjustment() {
        }

        public JrcAdjustment(double costVsDepreciated, double contentInventory, double undamageablePart, double materialUsed) {
            this.costVsDepreciated = costVsDepreciated;
            this.contentInventory = contentInventory;
            this.undamageablePart = undamageablePart;
            this.materialUsed = materialUsed;
        }
    }

    private static Map<String, JrcAdjustment> defaultJrcAdjustments() {
        Map<String, JrcAdjustment> map = new LinkedHashMap<>();
        map.put("residential", new JrcAdjustment(0.6, 0.5, 0.4, 1.0));
        map.put("commercial", new JrcAdjustment(0.6, 1.0, 0.4, 1.0));
        map.put("industrial", new JrcAdjustment(0.6, 1.5, 0.4, 1.0));
        return map;
    }
}
