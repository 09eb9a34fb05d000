package com.flamingo.ai.entities.service.symbols.model;

import java.util.List;

/**
 * A node of the symbol forest extracted from an equation's MathML.
 *
 * <p>Children are other members of the same forest and are matched by identity when the forest is
 * normalized, so two structurally equal symbols at different positions stay distinct.
 *
 * @param mathml MathML markup of the symbol
 * @param defined whether the equation defines this symbol
 * @param tokens tokens covered by the symbol, in document order
 * @param children symbols nested directly inside this one
 */
public record ParsedSymbol(
    String mathml, boolean defined, List<Token> tokens, List<ParsedSymbol> children) {}
