package com.claimlens.recalibration.config;

import com.claimlens.recalibration.config.properties.RecalibrationProperties;
import com.claimlens.recalibration.model.ScoringCoefficients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Configuration Properties Enablement
 *
 * <p>Binds {@link RecalibrationProperties} ({@code claimlens.recalibration.*}) with Bean Validation
 * and exposes the configured scoring coefficients and the clock used for recency filters.
 */
@Configuration
@EnableConfigurationProperties(RecalibrationProperties.class)
@Slf4j
public class ConfigurationPropertiesConfig {

    @Bean
    public ScoringCoefficients scoringCoefficients(RecalibrationProperties properties) {
        ScoringCoefficients coefficients = properties.getCoefficients();
        log.info("Scoring coefficients: {}", coefficients);
        log.info("Default weight table: {} factors, optimization defaults: {}",
                properties.getWeightTable().size(), properties.getOptimization());
        return coefficients;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
