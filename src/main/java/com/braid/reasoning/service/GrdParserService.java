package com.braid.reasoning.service;

import com.braid.reasoning.exception.GrdException;
import com.braid.reasoning.model.ExecutionPlan;
import com.braid.reasoning.model.GrdStructure;
import com.braid.reasoning.model.ValidationResult;
import com.braid.reasoning.service.graph.ExecutionPlanner;
import com.braid.reasoning.service.graph.GrdGraphBuilder;
import com.braid.reasoning.service.graph.GrdGraphValidator;
import com.braid.reasoning.service.mermaid.FlowchartSource;
import com.braid.reasoning.service.mermaid.FlowchartTokenizer;
import com.braid.reasoning.service.mermaid.MermaidCodeBlockExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for turning GRD text into a graph and an execution plan.
 *
 * Pipeline: extract -> tokenize -> parse statements -> build -> validate -> order.
 * Input that holds no fenced or keyword-led diagram is parsed as raw flowchart source.
 * Every call is independent; the service keeps no state between calls.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrdParserService {

    private final MermaidCodeBlockExtractor extractor;
    private final FlowchartTokenizer tokenizer;
    private final GrdGraphBuilder graphBuilder;
    private final GrdGraphValidator validator;
    private final ExecutionPlanner planner;

    public Optional<String> extract(String text) {
        return extractor.extract(text);
    }

    /**
     * Parse and build without structural validation. Syntax errors still throw.
     */
    public GrdStructure build(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String code = extractor.extract(text).orElse(text);
        FlowchartSource source = tokenizer.tokenize(code);
        return graphBuilder.build(source);
    }

    /**
     * Parse and validate, failing fast with the first syntax or structural error.
     */
    public GrdStructure parse(String text) {
        try {
            GrdStructure structure = build(text);
            validator.requireValid(structure);
            log.debug("Parsed GRD: {}", structure);
            return structure;
        } catch (GrdException e) {
            log.warn("Rejected GRD ({}): {}", e.errorType(), e.getMessage());
            throw e;
        }
    }

    /**
     * Boolean-plus-message check; never throws for a malformed diagram.
     */
    public ValidationResult validate(String text) {
        GrdStructure structure;
        try {
            structure = build(text);
        } catch (GrdException e) {
            return ValidationResult.failure(e.errorType(), e.getMessage(), List.of(), List.of());
        }
        return validator.validate(structure);
    }

    public List<String> order(String text) {
        return planner.order(parse(text));
    }

    public ExecutionPlan plan(String text) {
        return plan(parse(text));
    }

    public ExecutionPlan plan(GrdStructure structure) {
        ExecutionPlan plan = new ExecutionPlan(structure, planner.plan(structure));
        log.info("Planned {} steps over {} edges", plan.steps().size(), structure.edgeCount());
        return plan;
    }
}
