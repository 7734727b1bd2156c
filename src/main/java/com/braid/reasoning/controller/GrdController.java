package com.braid.reasoning.controller;

import com.braid.reasoning.dto.ExecutionPlanResponse;
import com.braid.reasoning.dto.GrdRequest;
import com.braid.reasoning.dto.PromptRequest;
import com.braid.reasoning.dto.graph.GrdGraphResponse;
import com.braid.reasoning.exception.MermaidExtractionException;
import com.braid.reasoning.model.GrdQualityReport;
import com.braid.reasoning.model.GrdStructure;
import com.braid.reasoning.model.ValidationResult;
import com.braid.reasoning.service.GrdParserService;
import com.braid.reasoning.service.mermaid.MermaidRenderer;
import com.braid.reasoning.service.metrics.GrdQualityMetrics;
import com.braid.reasoning.service.prompt.GrdPromptFormatter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller exposing GRD parsing, validation and planning.
 * Every endpoint takes the diagram text in the request body and keeps nothing between calls.
 */
@RestController
@RequestMapping("/api/grd")
@RequiredArgsConstructor
@Slf4j
public class GrdController {

    private final GrdParserService parserService;
    private final GrdQualityMetrics qualityMetrics;
    private final GrdPromptFormatter promptFormatter;
    private final MermaidRenderer renderer;

    /**
     * Pull the flowchart source out of free text. 404 when the text holds no diagram.
     */
    @PostMapping("/extract")
    public ResponseEntity<Map<String, String>> extract(@Valid @RequestBody GrdRequest request) {
        log.info("Extracting flowchart from {} chars of text", request.getText().length());
        String code = parserService.extract(request.getText())
                .orElseThrow(MermaidExtractionException::new);
        return ResponseEntity.ok(Map.of("code", code));
    }

    /**
     * Parse and validate a GRD. Syntax and structural errors are returned as 422.
     */
    @PostMapping("/parse")
    public ResponseEntity<GrdGraphResponse> parse(@Valid @RequestBody GrdRequest request) {
        log.info("Parsing GRD ({} chars)", request.getText().length());
        GrdStructure structure = parserService.parse(request.getText());
        return ResponseEntity.ok(GrdGraphResponse.from(structure));
    }

    /**
     * Validity check that reports problems in the body instead of failing the request.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@Valid @RequestBody GrdRequest request) {
        log.info("Validating GRD ({} chars)", request.getText().length());
        return ResponseEntity.ok(parserService.validate(request.getText()));
    }

    @PostMapping("/plan")
    public ResponseEntity<ExecutionPlanResponse> plan(@Valid @RequestBody GrdRequest request) {
        log.info("Planning GRD ({} chars)", request.getText().length());
        return ResponseEntity.ok(ExecutionPlanResponse.from(parserService.plan(request.getText())));
    }

    @PostMapping("/quality")
    public ResponseEntity<GrdQualityReport> quality(@Valid @RequestBody GrdRequest request) {
        log.info("Scoring GRD quality ({} chars)", request.getText().length());
        return ResponseEntity.ok(qualityMetrics.evaluate(request.getText()));
    }

    /**
     * Canonical flowchart text for a GRD, e.g. to store a normalized copy.
     */
    @PostMapping("/render")
    public ResponseEntity<Map<String, String>> render(@Valid @RequestBody GrdRequest request) {
        GrdStructure structure = parserService.parse(request.getText());
        return ResponseEntity.ok(Map.of("mermaid", renderer.render(structure)));
    }

    @PostMapping("/prompt")
    public ResponseEntity<Map<String, String>> prompt(@Valid @RequestBody PromptRequest request) {
        log.info("Building GRD prompt with {} examples",
                request.getExamples() == null ? 0 : request.getExamples().size());
        String prompt = promptFormatter.format(request.getProblem(), request.getExamples());
        return ResponseEntity.ok(Map.of("prompt", prompt));
    }
}
