package com.braid.reasoning.service.mermaid;

import com.braid.reasoning.model.FlowDirection;

/**
 * Tokenized flowchart: header metadata plus the remaining statements.
 *
 * @param headerPresent false when the first statement was not a {@code flowchart}/{@code graph} line
 * @param statements    lazy and restartable; each iteration rescans the source text
 */
public record FlowchartSource(boolean headerPresent, FlowDirection direction, Iterable<StatementLine> statements) {}
