package com.braid.reasoning.service.metrics;

import com.braid.reasoning.config.GrdProperties;
import com.braid.reasoning.exception.GrdException;
import com.braid.reasoning.model.GrdQualityReport;
import com.braid.reasoning.model.GrdStructure;
import com.braid.reasoning.service.GrdParserService;
import com.braid.reasoning.service.graph.ExecutionPlanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Scores how usable a generated GRD is as a reasoning plan.
 *
 * overall = validity * w1 + completeness * w2 + traceability * w3, and 0 for an invalid diagram.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrdQualityMetrics {

    private static final double START_SCORE = 0.3;
    private static final double END_SCORE = 0.3;
    private static final double SIZE_SCORE = 0.2;
    private static final double OVERSIZE_SCORE = 0.1;
    private static final double EDGE_SCORE = 0.2;

    private final GrdParserService parserService;
    private final ExecutionPlanner planner;
    private final GrdProperties properties;

    /**
     * 1.0 if the text parses and passes validation, else 0.0.
     */
    public double structuralValidity(String grd) {
        return parserService.validate(grd).valid() ? 1.0 : 0.0;
    }

    /**
     * Rewards a start, an end, a sensible node count and at least one edge.
     */
    public double completeness(GrdStructure structure) {
        GrdProperties.Metrics config = properties.getMetrics();
        double score = 0.0;

        if (!structure.startNodes().isEmpty()) {
            score += START_SCORE;
        }
        if (!structure.endNodes().isEmpty()) {
            score += END_SCORE;
        }

        int nodeCount = structure.nodeCount();
        if (nodeCount >= config.getMinNodes() && nodeCount <= config.getMaxNodes()) {
            score += SIZE_SCORE;
        } else if (nodeCount > config.getMaxNodes()) {
            score += OVERSIZE_SCORE;
        }

        if (structure.edgeCount() > 0) {
            score += EDGE_SCORE;
        }
        return Math.min(score, 1.0);
    }

    /**
     * Mean of the share of nodes that can be ordered and a cycle score (1.0 when every node can
     * be ordered, 0.5 otherwise). 0.0 when nothing can be ordered.
     */
    public double executionTraceability(GrdStructure structure) {
        if (structure.isEmpty()) {
            return 0.0;
        }
        List<String> ordered = planner.partialOrder(structure);
        if (ordered.isEmpty()) {
            return 0.0;
        }

        double reachability = (double) ordered.size() / structure.nodeCount();
        double cycleScore = ordered.size() == structure.nodeCount() ? 1.0 : 0.5;
        return (reachability + cycleScore) / 2.0;
    }

    public double overallQuality(String grd) {
        return evaluate(grd).overallQuality();
    }

    /**
     * All scores for {@code grd}. Text that fails to parse scores zero everywhere.
     */
    public GrdQualityReport evaluate(String grd) {
        GrdStructure structure;
        try {
            structure = parserService.build(grd);
        } catch (GrdException e) {
            log.debug("GRD scored zero, it does not parse: {}", e.getMessage());
            return GrdQualityReport.zero();
        }
        return evaluate(grd, structure);
    }

    /**
     * Scores using a structure the caller already built from {@code grd}.
     */
    public GrdQualityReport evaluate(String grd, GrdStructure structure) {
        GrdProperties.Metrics config = properties.getMetrics();

        double validity = structuralValidity(grd);
        double completeness = completeness(structure);
        double traceability = executionTraceability(structure);
        double overall = validity == 0.0
                ? 0.0
                : validity * config.getValidityWeight()
                + completeness * config.getCompletenessWeight()
                + traceability * config.getTraceabilityWeight();

        log.debug("GRD quality: validity={}, completeness={}, traceability={}, overall={}",
                validity, completeness, traceability, overall);
        return new GrdQualityReport(validity, completeness, traceability, overall);
    }
}
