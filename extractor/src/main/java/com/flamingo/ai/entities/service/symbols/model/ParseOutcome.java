package com.flamingo.ai.entities.service.symbols.model;

/**
 * Result reported by the external equation parser for one equation.
 *
 * @param success whether the equation was parsed
 * @param equation the equation the result is for
 * @param errorMessage parser error, empty on success
 * @param mathMl MathML produced for the equation; {@code null} unless {@code success}
 */
public record ParseOutcome(
    boolean success, Equation equation, String errorMessage, String mathMl) {}
