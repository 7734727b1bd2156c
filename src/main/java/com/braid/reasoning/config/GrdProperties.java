package com.braid.reasoning.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for diagram extraction, parsing, quality scoring and prompt building.
 * Bound from the {@code grd.*} keys in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "grd")
public class GrdProperties {

    private Parser parser = new Parser();

    private Extractor extractor = new Extractor();

    private Metrics metrics = new Metrics();

    private Prompt prompt = new Prompt();

    @Data
    public static class Parser {
        // Skip style/classDef/class/linkStyle/click/subgraph/end/direction lines instead of failing
        private boolean ignoreDirectives = true;
    }

    @Data
    public static class Extractor {
        // Accept an untagged fence that starts with flowchart/graph when no mermaid fence exists
        private boolean acceptUntaggedFences = true;
    }

    @Data
    public static class Metrics {
        private double validityWeight = 0.4;
        private double completenessWeight = 0.3;
        private double traceabilityWeight = 0.3;
        // Node count range considered a reasonable decomposition
        private int minNodes = 3;
        private int maxNodes = 20;
    }

    @Data
    public static class Prompt {
        private String defaultDirection = "TD";
    }
}
