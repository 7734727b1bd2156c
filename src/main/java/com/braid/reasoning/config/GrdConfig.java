package com.braid.reasoning.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;

@Configuration
@EnableConfigurationProperties(GrdProperties.class)
@Slf4j
public class GrdConfig {

    private final GrdProperties properties;

    public GrdConfig(GrdProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void logSettings() {
        log.info("[GRD Config] ignoreDirectives={}, acceptUntaggedFences={}, metric weights={}/{}/{}",
                properties.getParser().isIgnoreDirectives(),
                properties.getExtractor().isAcceptUntaggedFences(),
                properties.getMetrics().getValidityWeight(),
                properties.getMetrics().getCompletenessWeight(),
                properties.getMetrics().getTraceabilityWeight());
    }
}
