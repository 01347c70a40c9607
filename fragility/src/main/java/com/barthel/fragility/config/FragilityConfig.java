package com.barthel.fragility.config;

import com.barthel.fragility.application.service.hbom.CurveSelectionStrategy;
import com.barthel.fragility.application.service.hbom.FirstCurveSelection;
import com.barthel.fragility.application.service.hbom.HighestPrioritySelection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(FragilityProperties.class)
public class FragilityConfig {

    @Bean
    public CurveSelectionStrategy curveSelectionStrategy(FragilityProperties properties) {
        log.info("Fragility curve selection: {}", properties.getCurveSelection());
        return switch (properties.getCurveSelection()) {
            case FIRST -> new FirstCurveSelection();
            case HIGHEST_PRIORITY -> new HighestPrioritySelection();
        };
    }
}
