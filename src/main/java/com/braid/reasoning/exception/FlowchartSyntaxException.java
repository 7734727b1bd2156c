package com.braid.reasoning.exception;

import lombok.Getter;

/**
 * A statement line matches no supported flowchart form.
 */
@Getter
public class FlowchartSyntaxException extends GrdException {

    private final int lineNumber;
    private final String line;
    private final String reason;

    public FlowchartSyntaxException(int lineNumber, String line, String reason) {
        super(String.format("Syntax error on line %d: %s [%s]", lineNumber, reason, line));
        this.lineNumber = lineNumber;
        this.line = line;
        this.reason = reason;
    }

    @Override
    public String errorType() {
        return "SyntaxError";
    }
}
