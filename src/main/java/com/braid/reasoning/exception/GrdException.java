package com.braid.reasoning.exception;

/**
 * Base type for every failure raised while extracting, parsing, validating or ordering a GRD.
 */
public abstract class GrdException extends RuntimeException {

    protected GrdException(String message) {
        super(message);
    }

    /**
     * Stable taxonomy name reported to callers, e.g. {@code SyntaxError}.
     */
    public abstract String errorType();
}
