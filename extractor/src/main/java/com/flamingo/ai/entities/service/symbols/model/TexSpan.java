package com.flamingo.ai.entities.service.symbols.model;

/**
 * A substring of an equation's TeX with its equation-relative bounds.
 *
 * @param tex the covered TeX
 * @param start offset of the first covered character
 * @param end offset after the last covered character
 */
public record TexSpan(String tex, int start, int end) {}
