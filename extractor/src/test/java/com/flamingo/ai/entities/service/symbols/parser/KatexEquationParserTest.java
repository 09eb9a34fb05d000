package com.flamingo.ai.entities.service.symbols.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.entities.config.ExtractorConfig;
import com.flamingo.ai.entities.exception.EquationParsingException;
import com.flamingo.ai.entities.service.symbols.model.Equation;
import com.flamingo.ai.entities.service.symbols.model.ParseOutcome;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("KatexEquationParser Tests")
class KatexEquationParserTest {

  private static final String DOCUMENT_ID = "1601.00001";

  private static final String PARSED_LINE =
      "{\"success\": true, \"i\": 0, \"tex_path\": \"main.tex\", \"equation\": \"x_i\","
          + " \"equation_start\": 120, \"equation_depth\": 1, \"context_tex\": \"Let $x_i$\","
          + " \"errorMessage\": \"\", \"mathMl\": \"<math><mi>x</mi></math>\"}";
  private static final String FAILED_LINE =
      "{\"success\": false, \"i\": \"1\", \"tex_path\": \"main.tex\", \"equation\": \"\\\\frac{\","
          + " \"equation_start\": \"300\", \"equation_depth\": 0, \"context_tex\": \"\","
          + " \"errorMessage\": \"Expected group after '\\\\frac'\"}";
  private static final String PLAIN_LINE =
      "{\"success\": false, \"i\": 4, \"tex_path\": \"main.tex\", \"equation\": \"x+\","
          + " \"equation_start\": 3, \"equation_depth\": 0, \"context_tex\": \"\","
          + " \"errorMessage\": \"Unexpected end of input\"}";

  @TempDir Path workspace;

  private ExtractorConfig config;
  private KatexEquationParser parser;

  @BeforeEach
  void setUp() {
    config = new ExtractorConfig();
    config.getParser().setWorkingDirectory(workspace.resolve("node").toString());
    parser = new KatexEquationParser(config, new ObjectMapper());
  }

  @Nested
  @DisplayName("Reading parser output")
  class ParseOutput {

    @Test
    @DisplayName("should read one outcome per JSON line and skip blank lines")
    void shouldReadOneOutcomePerLine() {
      List<ParseOutcome> outcomes =
          parser.parseOutput(DOCUMENT_ID, PARSED_LINE + "\n\n" + FAILED_LINE + "\n");

      assertThat(outcomes).hasSize(2);

      ParseOutcome parsed = outcomes.get(0);
      assertThat(parsed.success()).isTrue();
      assertThat(parsed.equation())
          .isEqualTo(new Equation(0, "main.tex", "x_i", 120, 1, "Let $x_i$"));
      assertThat(parsed.errorMessage()).isEmpty();
      assertThat(parsed.mathMl()).isEqualTo("<math><mi>x</mi></math>");

      ParseOutcome failed = outcomes.get(1);
      assertThat(failed.success()).isFalse();
      assertThat(failed.equation().index()).isEqualTo(1);
      assertThat(failed.equation().start()).isEqualTo(300);
      assertThat(failed.equation().tex()).isEqualTo("\\frac{");
      assertThat(failed.errorMessage()).isEqualTo("Expected group after '\\frac'");
      assertThat(failed.mathMl()).isNull();
    }

    @Test
    @DisplayName("should return no outcomes for empty output")
    void shouldReturnNothing_whenOutputIsEmpty() {
      assertThat(parser.parseOutput(DOCUMENT_ID, "\n")).isEmpty();
    }

    @Test
    @DisplayName("should fail the document when a line is not JSON")
    void shouldFail_whenLineIsNotJson() {
      assertThatThrownBy(() -> parser.parseOutput(DOCUMENT_ID, "npm WARN something"))
          .isInstanceOf(EquationParsingException.class)
          .hasMessageContaining("npm WARN something");
    }
  }

  @Nested
  @DisplayName("Building the command")
  class BuildCommand {

    @Test
    @DisplayName("should pass the equations path relative to the working directory")
    void shouldPassRelativePathAndErrorColor() {
      Path workingDirectory = workspace.resolve("node");
      Path equations = workspace.resolve("data/detected-equations/doc/entities.csv");

      List<String> command = parser.buildCommand(config.getParser(), workingDirectory, equations);

      assertThat(command)
          .containsExactly(
              "npm",
              "--silent",
              "start",
              "equations-csv",
              "../data/detected-equations/doc/entities.csv",
              "--",
              "--error-color",
              "#b22222");
    }

    @Test
    @DisplayName("should ask the parser to throw on errors when configured")
    void shouldAddThrowOnError_whenEnabled() {
      config.getParser().setThrowOnError(true);
      config.getParser().setErrorColor("red");

      List<String> command =
          parser.buildCommand(
              config.getParser(), workspace.resolve("node"), workspace.resolve("eq.csv"));

      assertThat(command.subList(5, command.size()))
          .containsExactly("--", "--throw-on-error", "--error-color", "red");
    }
  }

  @Nested
  @DisplayName("Running the parser process")
  @EnabledOnOs({OS.LINUX, OS.MAC})
  class RunProcess {

    private Path equationsFile;

    @BeforeEach
    void setUpWorkspace() throws Exception {
      Files.createDirectories(workspace.resolve("node"));
      equationsFile = workspace.resolve("entities.csv");
      Files.writeString(equationsFile, "");
    }

    private void givenScript(String script) {
      config.getParser().setCommand(List.of("sh", "-c", script, "sh"));
    }

    @Test
    @DisplayName("should return the outcomes printed by the process")
    void shouldReturnOutcomes_whenProcessSucceeds() {
      givenScript("printf '%s\\n' '" + PLAIN_LINE + "'");

      List<ParseOutcome> outcomes = parser.parse(DOCUMENT_ID, equationsFile);

      assertThat(outcomes).hasSize(1);
      assertThat(outcomes.get(0).success()).isFalse();
      assertThat(outcomes.get(0).equation().index()).isEqualTo(4);
      assertThat(outcomes.get(0).errorMessage()).isEqualTo("Unexpected end of input");
    }

    @Test
    @DisplayName("should fail with captured output when the process exits nonzero")
    void shouldFailWithOutput_whenProcessExitsNonzero() {
      givenScript("echo partial output; echo katex crashed >&2; exit 3");

      assertThatThrownBy(() -> parser.parse(DOCUMENT_ID, equationsFile))
          .isInstanceOfSatisfying(
              EquationParsingException.class,
              e -> {
                assertThat(e.getDocumentId()).isEqualTo(DOCUMENT_ID);
                assertThat(e.getMessage())
                    .contains(DOCUMENT_ID)
                    .contains("exit status 3")
                    .contains("partial output")
                    .contains("katex crashed");
              });
    }

    @Test
    @DisplayName("should give up on a process that runs past the timeout")
    void shouldFail_whenProcessTimesOut() {
      givenScript("sleep 5");
      config.getParser().setTimeout(Duration.ofMillis(200));

      assertThatThrownBy(() -> parser.parse(DOCUMENT_ID, equationsFile))
          .isInstanceOf(EquationParsingException.class)
          .hasMessageContaining("timed out");
    }

    @Test
    @DisplayName("should also kill processes started by a parser that timed out")
    void shouldKillChildProcesses_whenProcessTimesOut() throws Exception {
      Path marker = workspace.resolve("child-finished");
      givenScript("(sleep 1; touch '" + marker + "') & wait");
      config.getParser().setTimeout(Duration.ofMillis(200));

      assertThatThrownBy(() -> parser.parse(DOCUMENT_ID, equationsFile))
          .isInstanceOf(EquationParsingException.class)
          .hasMessageContaining("timed out");

      Thread.sleep(2000);
      assertThat(marker).doesNotExist();
    }

    @Test
    @DisplayName("should fail when the command cannot be started")
    void shouldFail_whenCommandIsMissing() {
      config.getParser().setCommand(List.of("no-such-equation-parser-binary"));

      assertThatThrownBy(() -> parser.parse(DOCUMENT_ID, equationsFile))
          .isInstanceOf(EquationParsingException.class)
          .hasMessageContaining("Could not run equation parser");
    }
  }
}
