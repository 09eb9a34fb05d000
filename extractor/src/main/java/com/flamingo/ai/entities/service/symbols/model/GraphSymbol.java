package com.flamingo.ai.entities.service.symbols.model;

import java.util.List;

/**
 * A symbol retained in a {@link SymbolGraph}. Edges to tokens and child symbols are indices within
 * the same equation.
 *
 * @param index position of the symbol in the equation's forest
 * @param mathml MathML markup of the symbol
 * @param defined whether the equation defines this symbol
 * @param span reconstructed TeX of the symbol, relative to the equation
 * @param start absolute offset of the span in the TeX file
 * @param end absolute offset after the span in the TeX file
 * @param tokenIndices indices of the tokens covered by the symbol
 * @param childIndices forest positions of the symbols nested in this one
 */
public record GraphSymbol(
    int index,
    String mathml,
    boolean defined,
    TexSpan span,
    int start,
    int end,
    List<Integer> tokenIndices,
    List<Integer> childIndices) {}
