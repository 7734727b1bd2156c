package com.braid.reasoning.service.prompt;

import com.braid.reasoning.config.GrdProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Builds the planning prompt that asks a model to draw a GRD for a problem.
 * The prompt is plain text; sending it to a model is the caller's concern.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GrdPromptFormatter {

    private static final String TEMPLATE = """
            Solve the problem below with structured reasoning.

            First draw a Guided Reasoning Diagram (GRD): a Mermaid flowchart whose nodes are the \
            reasoning steps and whose arrows point from a step to the steps that need its result. \
            Then work through the diagram one step at a time.

            Problem: %s

            The flowchart should cover:
            1. Analysis of the problem
            2. The solution steps
            3. Any decision points, with labelled branches
            4. Derivation of the final answer

            Use this format:
            ```mermaid
            flowchart %s
                Start[Analyse the problem] --> Step1[First step]
                Step1 --> Step2[Second step]
                Step2 --> Answer[Final answer]
            ```
            """;

    private final GrdProperties properties;

    public String format(String problem) {
        return format(problem, List.of());
    }

    /**
     * @param examples few-shot examples appended after the instructions; may be null or empty
     */
    public String format(String problem, List<GrdExample> examples) {
        Objects.requireNonNull(problem, "problem must not be null");

        StringBuilder prompt = new StringBuilder(
                String.format(TEMPLATE, problem.strip(), properties.getPrompt().getDefaultDirection()));

        if (examples != null && !examples.isEmpty()) {
            prompt.append("\n\nExamples:\n");
            for (int i = 0; i < examples.size(); i++) {
                GrdExample example = examples.get(i);
                prompt.append("\nExample ").append(i + 1).append(":\n");
                prompt.append("Problem: ").append(nullToEmpty(example.problem())).append('\n');
                prompt.append("GRD:\n").append(nullToEmpty(example.grd())).append('\n');
            }
        }

        log.debug("Formatted GRD prompt with {} examples ({} chars)",
                examples == null ? 0 : examples.size(), prompt.length());
        return prompt.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
