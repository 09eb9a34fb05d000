package com.flamingo.ai.entities.service.symbols.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.entities.service.symbols.model.ParsedSymbol;
import com.flamingo.ai.entities.service.symbols.model.Token;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MathMlSymbolForestExtractor Tests")
class MathMlSymbolForestExtractorTest {

  // x_i+y with y marked as defined
  private static final String SUBSCRIPT_MATHML =
      "<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><semantics><mrow>"
          + "<msub>"
          + "<mi s2:start=\"0\" s2:end=\"1\" s2:index=\"0\">x</mi>"
          + "<mi s2:start=\"2\" s2:end=\"3\" s2:index=\"1\">i</mi>"
          + "</msub>"
          + "<mo s2:start=\"3\" s2:end=\"4\" s2:index=\"2\">+</mo>"
          + "<mi s2:start=\"4\" s2:end=\"5\" s2:index=\"3\" s2:is-definition=\"true\">y</mi>"
          + "</mrow></semantics></math>";

  private final MathMlSymbolForestExtractor extractor = new MathMlSymbolForestExtractor();

  @Test
  @DisplayName("should list symbols in document order with scripted symbols before their parts")
  void shouldListSymbolsInDocumentOrder() {
    List<ParsedSymbol> forest = extractor.extract(SUBSCRIPT_MATHML);

    assertThat(forest).hasSize(4);
    assertThat(forest.get(0).mathml()).startsWith("<msub");
    assertThat(forest.get(1).mathml()).contains(">x</mi>");
    assertThat(forest.get(2).mathml()).contains(">i</mi>");
    assertThat(forest.get(3).mathml()).contains(">y</mi>");
  }

  @Test
  @DisplayName("should link scripted symbols to the forest members nested in them")
  void shouldLinkChildrenToForestMembers() {
    List<ParsedSymbol> forest = extractor.extract(SUBSCRIPT_MATHML);

    ParsedSymbol subscript = forest.get(0);
    assertThat(subscript.children()).hasSize(2);
    assertThat(subscript.children().get(0)).isSameAs(forest.get(1));
    assertThat(subscript.children().get(1)).isSameAs(forest.get(2));
    assertThat(forest.get(3).children()).isEmpty();
  }

  @Test
  @DisplayName("should share token instances between nested symbols")
  void shouldShareTokens_betweenNestedSymbols() {
    List<ParsedSymbol> forest = extractor.extract(SUBSCRIPT_MATHML);

    ParsedSymbol subscript = forest.get(0);
    assertThat(subscript.tokens())
        .containsExactly(new Token(0, 0, 1, "x"), new Token(1, 2, 3, "i"));
    assertThat(subscript.tokens().get(0)).isSameAs(forest.get(1).tokens().get(0));
    assertThat(subscript.tokens().get(1)).isSameAs(forest.get(2).tokens().get(0));
  }

  @Test
  @DisplayName("should read the definition flag and default it to false")
  void shouldReadDefinitionFlag() {
    List<ParsedSymbol> forest = extractor.extract(SUBSCRIPT_MATHML);

    assertThat(forest).extracting(ParsedSymbol::defined).containsExactly(false, false, false, true);
  }

  @Test
  @DisplayName("should not treat scripts on numbers as symbols")
  void shouldIgnoreScripts_whenBaseIsNotSymbol() {
    String mathMl =
        "<math><msup>"
            + "<mn s2:start=\"0\" s2:end=\"1\">2</mn>"
            + "<mi s2:start=\"2\" s2:end=\"3\">n</mi>"
            + "</msup></math>";

    List<ParsedSymbol> forest = extractor.extract(mathMl);

    assertThat(forest).hasSize(1);
    assertThat(forest.get(0).tokens()).extracting(Token::text).containsExactly("n");
  }

  @Test
  @DisplayName("should number tokens in document order when the parser gives no index")
  void shouldNumberTokens_whenIndexIsMissing() {
    String mathMl =
        "<math><mi s2:start=\"0\" s2:end=\"1\">a</mi><mi s2:start=\"2\" s2:end=\"3\">b</mi></math>";

    List<ParsedSymbol> forest = extractor.extract(mathMl);

    assertThat(forest).extracting(symbol -> symbol.tokens().get(0).index()).containsExactly(0, 1);
  }

  @Test
  @DisplayName("should number unindexed tokens after the largest explicit index")
  void shouldNotReuseExplicitIndex_whenSomeIndicesAreMissing() {
    String mathMl =
        "<math>"
            + "<mi s2:start=\"0\" s2:end=\"1\">a</mi>"
            + "<mi s2:start=\"2\" s2:end=\"3\" s2:index=\"0\">b</mi>"
            + "<mi s2:start=\"4\" s2:end=\"5\">c</mi>"
            + "</math>";

    List<ParsedSymbol> forest = extractor.extract(mathMl);

    assertThat(forest)
        .extracting(symbol -> symbol.tokens().get(0).index())
        .containsExactly(1, 0, 2);
  }

  @Test
  @DisplayName("should keep identifiers without offsets as symbols without tokens")
  void shouldKeepSymbol_withoutTokens_whenOffsetsMissing() {
    List<ParsedSymbol> forest = extractor.extract("<math><mi>z</mi></math>");

    assertThat(forest).hasSize(1);
    assertThat(forest.get(0).tokens()).isEmpty();
  }

  @Test
  @DisplayName("should reject MathML that is not well formed")
  void shouldReject_whenMathMlIsMalformed() {
    assertThatThrownBy(() -> extractor.extract("<math><mi>x</math>"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
