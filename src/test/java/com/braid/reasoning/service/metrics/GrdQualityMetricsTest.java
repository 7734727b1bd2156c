package com.braid.reasoning.service.metrics;

import com.braid.reasoning.config.GrdProperties;
import com.braid.reasoning.model.GrdQualityReport;
import com.braid.reasoning.service.graph.CycleDetector;
import com.braid.reasoning.service.graph.ExecutionPlanner;
import com.braid.reasoning.testutil.GrdTestFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.braid.reasoning.testutil.GrdTestFactory.chain;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GrdQualityMetricsTest {

    private static final double EPS = 1e-9;

    private GrdProperties properties;
    private GrdQualityMetrics metrics;

    @BeforeEach
    void setUp() {
        properties = new GrdProperties();
        metrics = new GrdQualityMetrics(GrdTestFactory.parserService(properties),
                new ExecutionPlanner(new CycleDetector()), properties);
    }

    @Test
    void wellFormedDiagramScoresFull() {
        GrdQualityReport report = metrics.evaluate(GrdTestFactory.DIAMOND);

        assertThat(report.structuralValidity()).isEqualTo(1.0);
        assertThat(report.completeness()).isCloseTo(1.0, within(EPS));
        assertThat(report.executionTraceability()).isEqualTo(1.0);
        assertThat(report.overallQuality()).isCloseTo(1.0, within(EPS));
    }

    @Test
    void singleNodeIsValidButIncomplete() {
        GrdQualityReport report = metrics.evaluate("A[Only]");

        assertThat(report.completeness()).isCloseTo(0.6, within(EPS));
        assertThat(report.executionTraceability()).isEqualTo(1.0);
        assertThat(report.overallQuality()).isCloseTo(0.88, within(EPS));
    }

    @Test
    void cyclicDiagramScoresZeroOverall() {
        GrdQualityReport report = metrics.evaluate("S --> A\nA --> B\nB --> A");

        assertThat(report.structuralValidity()).isZero();
        assertThat(report.completeness()).isCloseTo(0.7, within(EPS));
        // only S can be ordered: (1/3 + 0.5) / 2
        assertThat(report.executionTraceability()).isCloseTo(5.0 / 12.0, within(EPS));
        assertThat(report.overallQuality()).isZero();
    }

    @Test
    void fullyCyclicDiagramHasNoTraceability() {
        assertThat(metrics.evaluate(GrdTestFactory.TWO_CYCLE).executionTraceability()).isZero();
    }

    @Test
    void unparseableDiagramScoresZero() {
        assertThat(metrics.evaluate("A -> B")).isEqualTo(GrdQualityReport.zero());
        assertThat(metrics.overallQuality("flowchart TD\nA[oops")).isZero();
    }

    @Test
    void oversizedDiagramLosesPartOfSizeScore() {
        assertThat(metrics.completeness(chain(25))).isCloseTo(0.9, within(EPS));
    }

    @Test
    void nodeCountRangeIsConfigurable() {
        properties.getMetrics().setMaxNodes(3);

        assertThat(metrics.completeness(GrdTestFactory.parserService().build(GrdTestFactory.DIAMOND)))
                .isCloseTo(0.9, within(EPS));
    }

    @Test
    void weightsAreConfigurable() {
        properties.getMetrics().setValidityWeight(1.0);
        properties.getMetrics().setCompletenessWeight(0.0);
        properties.getMetrics().setTraceabilityWeight(0.0);

        assertThat(metrics.overallQuality("A[Only]")).isEqualTo(1.0);
    }
}
