package com.braid.reasoning.dto;

import com.braid.reasoning.dto.graph.GrdGraphResponse;
import com.braid.reasoning.model.ExecutionPlan;
import com.braid.reasoning.model.ExecutionStep;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPlanResponse {

    private List<String> order;
    private List<ExecutionStep> steps;
    private GrdGraphResponse graph;

    public static ExecutionPlanResponse from(ExecutionPlan plan) {
        return ExecutionPlanResponse.builder()
                .order(plan.order())
                .steps(plan.steps())
                .graph(GrdGraphResponse.from(plan.structure()))
                .build();
    }
}
