package com.braid.reasoning.exception;

public class EmptyGraphException extends GrdException {

    public EmptyGraphException() {
        super("Diagram contains no nodes");
    }

    @Override
    public String errorType() {
        return "EmptyGraphError";
    }
}
