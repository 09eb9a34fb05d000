package com.flamingo.ai.entities.service.symbols.model;

/**
 * One math expression detected in a document's TeX source.
 *
 * @param index sequential index of the equation within its document
 * @param texPath path of the TeX file the equation was found in
 * @param tex raw TeX of the equation body
 * @param start absolute character offset of the equation body in {@code texPath}
 * @param depth nesting depth of the equation inside other equations or environments
 * @param contextTex TeX surrounding the equation
 */
public record Equation(
    int index, String texPath, String tex, int start, int depth, String contextTex) {}
