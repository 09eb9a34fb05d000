package com.flamingo.ai.entities.service.symbols;

import com.flamingo.ai.entities.service.symbols.model.TexSpan;
import com.flamingo.ai.entities.service.symbols.model.Token;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers the TeX covering a symbol from the offsets of its tokens.
 *
 * <p>Token offsets reported by the parser leave out grouping braces and styling macros, so the raw
 * token range can start inside {@code \mathrm{...}} or stop before a closing brace. The span is
 * widened to take in a styling macro whose argument starts at the first token, and then to the
 * first point after the last token where all braces opened inside the span are closed.
 *
 * <p>Only macros named {@code \math...} or {@code \text...} are absorbed. If the braces never
 * balance (the equation TeX was truncated upstream) the end stays at the last token's end.
 */
public final class TexSpanReconstructor {

  private static final Pattern STYLE_MACRO = Pattern.compile("\\\\(?:math|text)\\w+\\{");

  private TexSpanReconstructor() {}

  /**
   * Computes the span of a symbol.
   *
   * @param tokens tokens covered by the symbol; must not be empty
   * @param equationTex TeX of the equation the token offsets refer to
   * @return the reconstructed span, relative to {@code equationTex}
   */
  public static TexSpan reconstruct(List<Token> tokens, String equationTex) {
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("Cannot reconstruct the span of a symbol without tokens");
    }

    int start = tokens.stream().mapToInt(Token::start).min().getAsInt();
    int end = tokens.stream().mapToInt(Token::end).max().getAsInt();

    start = absorbStyleMacro(equationTex, start);
    end = closeOpenBraces(equationTex, start, end);

    return new TexSpan(slice(equationTex, start, end), start, end);
  }

  /**
   * Returns the TeX between two offsets, clamped to the bounds of {@code tex}. Offsets reported
   * by the parser can run past the end of equations that were truncated upstream.
   */
  public static String slice(String tex, int start, int end) {
    int from = Math.max(0, Math.min(start, tex.length()));
    int to = Math.max(from, Math.min(end, tex.length()));
    return tex.substring(from, to);
  }

  private static int absorbStyleMacro(String tex, int start) {
    Matcher matcher = STYLE_MACRO.matcher(tex);
    int adjusted = start;
    while (matcher.find()) {
      if (matcher.end() == start) {
        adjusted = matcher.start();
      }
    }
    return adjusted;
  }

  private static int closeOpenBraces(String tex, int start, int end) {
    int openBraces = 0;
    for (int i = start; i < tex.length(); i++) {
      char c = tex.charAt(i);
      if (c == '{') {
        openBraces++;
      } else if (c == '}' && openBraces > 0) {
        openBraces--;
      }
      if (i + 1 >= end && openBraces == 0) {
        return i + 1;
      }
    }
    return end;
  }
}
