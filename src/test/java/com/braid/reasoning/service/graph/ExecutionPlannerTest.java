package com.braid.reasoning.service.graph;

import com.braid.reasoning.exception.CycleException;
import com.braid.reasoning.exception.EmptyGraphException;
import com.braid.reasoning.model.ExecutionStep;
import com.braid.reasoning.model.GrdStructure;
import com.braid.reasoning.service.GrdParserService;
import com.braid.reasoning.testutil.GrdTestFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.braid.reasoning.testutil.GrdTestFactory.chain;
import static com.braid.reasoning.testutil.GrdTestFactory.graph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionPlannerTest {

    private final ExecutionPlanner planner = new ExecutionPlanner(new CycleDetector());
    private final GrdParserService parserService = GrdTestFactory.parserService();

    @Test
    void ordersLinearDiagram() {
        GrdStructure structure = parserService.build(GrdTestFactory.LINEAR);

        assertThat(planner.order(structure)).containsExactly("A", "B", "C");
    }

    @Test
    void ordersDiamondAndListsDependencies() {
        GrdStructure structure = parserService.build(GrdTestFactory.DIAMOND);

        List<ExecutionStep> steps = planner.plan(structure);

        assertThat(steps).extracting(ExecutionStep::stepId).containsExactly("A", "B", "C", "D");
        assertThat(steps).extracting(ExecutionStep::stepNumber).containsExactly(1, 2, 3, 4);
        assertThat(steps.get(0).isEntryStep()).isTrue();
        assertThat(steps.get(3).dependsOn()).containsExactly("B", "C");
    }

    @Test
    void singleNodeIsItsOwnPlan() {
        List<ExecutionStep> steps = planner.plan(parserService.build("A[Only]"));

        assertThat(steps).containsExactly(new ExecutionStep("A", 1, "Only", List.of()));
    }

    @Test
    void readyNodesAreTakenInDeclarationOrder() {
        // declaration order C, D, A, B; D becomes ready after A and goes before B
        GrdStructure structure = parserService.build("C --> D\nA --> D\nB");

        assertThat(planner.order(structure)).containsExactly("C", "A", "D", "B");
    }

    @Test
    void parallelEdgesCountOnceInDependencies() {
        GrdStructure structure = graph("A->B", "A->B", "C->B");

        assertThat(planner.order(structure)).containsExactly("A", "C", "B");
        assertThat(planner.plan(structure).get(2).dependsOn()).containsExactly("A", "C");
    }

    @Test
    void everyEdgePointsForwardInTheOrder() {
        GrdStructure structure = graph("E->F", "A->C", "B->C", "C->E", "A->F", "D->B");

        List<String> order = planner.order(structure);

        assertThat(order).hasSize(structure.nodeCount());
        structure.getEdges().forEach(edge ->
                assertThat(order.indexOf(edge.fromId())).isLessThan(order.indexOf(edge.toId())));
    }

    @Test
    void cycleFailsWithoutPartialOrder() {
        GrdStructure structure = graph("A->B", "B->A");

        assertThatThrownBy(() -> planner.order(structure))
                .isExactlyInstanceOf(CycleException.class)
                .satisfies(e -> assertThat(((CycleException) e).getCycle()).containsExactly("A", "B", "A"));
    }

    @Test
    void partialOrderStopsAtCycle() {
        GrdStructure structure = graph("S->A", "A->B", "B->A", "B->T");

        assertThat(planner.partialOrder(structure)).containsExactly("S");
        assertThatThrownBy(() -> planner.order(structure)).isInstanceOf(CycleException.class);
    }

    @Test
    void emptyGraphCannotBeOrdered() {
        assertThatThrownBy(() -> planner.order(GrdStructure.empty()))
                .isInstanceOf(EmptyGraphException.class);
    }

    @Test
    void ordersLongChain() {
        GrdStructure structure = chain(5_000);

        List<String> order = planner.order(structure);

        assertThat(order).hasSize(5_000);
        assertThat(order.get(0)).isEqualTo("N0");
        assertThat(order.get(4_999)).isEqualTo("N4999");
    }

    @Test
    void toStepsRejectsOrdersThatAreNotPermutations() {
        GrdStructure structure = graph("A->B");

        assertThatThrownBy(() -> planner.toSteps(structure, List.of("A")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.toSteps(structure, List.of("A", "A")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> planner.toSteps(structure, List.of("A", "Z")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
