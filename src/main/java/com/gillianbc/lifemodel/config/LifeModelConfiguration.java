package com.gillianbc.lifemodel.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring wiring for the tax and settlement services.
 * <p>
 * {@code lifemodel.config-file} points at an optional YAML overlay and
 * {@code lifemodel.scenario} names an optional predefined scenario.
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.gillianbc.lifemodel.service")
public class LifeModelConfiguration {

    @Bean
    public FinancialConfig financialConfig(@Value("${lifemodel.config-file:}") String configFile,
                                           @Value("${lifemodel.scenario:}") String scenario) {
        FinancialConfig config = configFile.isBlank()
                ? FinancialConfig.defaults()
                : FinancialConfigLoader.load(Path.of(configFile));
        if (!scenario.isBlank()) {
            config = config.withScenario(scenario);
        }
        log.info("Financial configuration ready (scenario: {})", scenario.isBlank() ? "none" : scenario);
        return config;
    }
}
