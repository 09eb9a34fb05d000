package com.flamingo.ai.entities.service.symbols.model;

/**
 * A leaf of a parsed equation. Offsets are relative to the equation's TeX.
 *
 * @param index index assigned by the equation parser, unique within the equation
 * @param start first character covered by the token
 * @param end character after the last one covered by the token
 * @param text literal text of the token
 */
public record Token(int index, int start, int end, String text) {}
