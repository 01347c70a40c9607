package com.barthel.fragility.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the fragility service, bound from {@code fragility.*}.
 */
@Data
@ConfigurationProperties(prefix = "fragility")
public class FragilityProperties {

    public enum CurveSelection {
        /** First stored curve per hazard wins. */
        FIRST,
        /** Highest priority wins, ties keep the first stored curve. */
        HIGHEST_PRIORITY
    }

    private ClimateService climateService = new ClimateService();

    /** How a curve is picked when a component has several for one hazard. */
    private CurveSelection curveSelection = CurveSelection.FIRST;

    /** Deepest hierarchy accepted by reconstruction and computation. */
    private int maxTreeDepth = 64;

    @Data
    public static class ClimateService {
        /** Base URL of the climate service serving prepared datasets. */
        private String baseUrl = "http://localhost:8000/api/climate";

        private Duration timeout = Duration.ofSeconds(30);
    }
}
