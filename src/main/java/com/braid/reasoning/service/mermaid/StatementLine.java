package com.braid.reasoning.service.mermaid;

/**
 * One logical flowchart statement.
 *
 * @param lineNumber 1-based line in the flowchart source, blank and comment lines counted
 * @param text       trimmed statement text with whitespace runs collapsed
 */
public record StatementLine(int lineNumber, String text) {}
