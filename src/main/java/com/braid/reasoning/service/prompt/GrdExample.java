package com.braid.reasoning.service.prompt;

/**
 * A solved few-shot example: a problem and the diagram that plans its solution.
 */
public record GrdExample(String problem, String grd) {}
