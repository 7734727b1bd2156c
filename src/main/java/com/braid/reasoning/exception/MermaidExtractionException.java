package com.braid.reasoning.exception;

/**
 * No flowchart text could be found in the input.
 */
public class MermaidExtractionException extends GrdException {

    public MermaidExtractionException() {
        super("No mermaid code block or flowchart definition found in input");
    }

    @Override
    public String errorType() {
        return "ExtractionNotFound";
    }
}
