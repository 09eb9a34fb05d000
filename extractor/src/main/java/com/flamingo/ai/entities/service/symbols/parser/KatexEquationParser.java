package com.flamingo.ai.entities.service.symbols.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.entities.config.ExtractorConfig;
import com.flamingo.ai.entities.exception.EquationParsingException;
import com.flamingo.ai.entities.service.symbols.model.Equation;
import com.flamingo.ai.entities.service.symbols.model.ParseOutcome;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link EquationParser} that runs the KaTeX-based equation parser as an external process.
 *
 * <p>The process reads the equations table itself and prints one JSON object per equation:
 *
 * <pre>{@code
 * {"success": true, "i": 0, "tex_path": "main.tex", "equation": "x_i", "equation_start": 120,
 *  "equation_depth": 0, "context_tex": "...", "errorMessage": "", "mathMl": "<math>...</math>"}
 * }</pre>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KatexEquationParser implements EquationParser {

  private static final Duration TERMINATION_TIMEOUT = Duration.ofSeconds(10);

  private final ExtractorConfig extractorConfig;
  private final ObjectMapper objectMapper;

  @Override
  public List<ParseOutcome> parse(String documentId, Path equationsFile) {
    ExtractorConfig.Parser parserConfig = extractorConfig.getParser();
    Path workingDirectory = Path.of(parserConfig.getWorkingDirectory()).toAbsolutePath();
    List<String> command = buildCommand(parserConfig, workingDirectory, equationsFile);
    log.debug("Running equation parser for {} with arguments: {}", documentId, command);

    Path stdoutFile = null;
    Path stderrFile = null;
    try {
      stdoutFile = Files.createTempFile("equation-parser-", ".out");
      stderrFile = Files.createTempFile("equation-parser-", ".err");

      Process process =
          new ProcessBuilder(command)
              .directory(workingDirectory.toFile())
              .redirectOutput(stdoutFile.toFile())
              .redirectError(stderrFile.toFile())
              .start();

      boolean finished =
          process.waitFor(parserConfig.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        terminate(process);
        throw new EquationParsingException(
            documentId,
            String.format(
                "Equation parsing for %s timed out after %s",
                documentId, parserConfig.getTimeout()));
      }

      String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
      if (process.exitValue() != 0) {
        String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
        throw new EquationParsingException(
            documentId,
            String.format(
                "Equation parsing for %s unexpectedly failed with exit status %d."
                    + "%nStdout: %s%nStderr: %s",
                documentId, process.exitValue(), stdout, stderr));
      }
      return parseOutput(documentId, stdout);

    } catch (IOException e) {
      throw new EquationParsingException(
          documentId, "Could not run equation parser for " + documentId + ": " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EquationParsingException(
          documentId, "Interrupted while parsing equations for " + documentId, e);
    } finally {
      deleteQuietly(stdoutFile);
      deleteQuietly(stderrFile);
    }
  }

  /** Kills the parser and the processes it started, such as {@code node} under {@code npm}. */
  private void terminate(Process process) throws InterruptedException {
    // Collected before the parent dies, after which its children are reparented.
    List<ProcessHandle> descendants = process.descendants().toList();
    descendants.forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    if (!process.waitFor(TERMINATION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
      log.warn("Equation parser process {} did not exit after being killed", process.pid());
    }
  }

  List<String> buildCommand(
      ExtractorConfig.Parser parserConfig, Path workingDirectory, Path equationsFile) {
    List<String> command = new ArrayList<>(parserConfig.getCommand());
    command.add(workingDirectory.relativize(equationsFile.toAbsolutePath()).toString());
    command.add("--");
    if (parserConfig.isThrowOnError()) {
      command.add("--throw-on-error");
    }
    command.add("--error-color");
    command.add(parserConfig.getErrorColor());
    return command;
  }

  /** Reads the parser's output, one JSON object per non-blank line. */
  List<ParseOutcome> parseOutput(String documentId, String stdout) {
    List<ParseOutcome> outcomes = new ArrayList<>();
    for (String line : stdout.strip().split("\\R")) {
      if (line.isBlank()) {
        continue;
      }
      JsonNode data;
      try {
        data = objectMapper.readTree(line);
      } catch (JsonProcessingException e) {
        throw new EquationParsingException(
            documentId, "Equation parser printed a line that is not JSON: " + line, e);
      }

      boolean success = data.path("success").asBoolean(false);
      Equation equation =
          new Equation(
              data.path("i").asInt(),
              data.path("tex_path").asText(""),
              data.path("equation").asText(""),
              data.path("equation_start").asInt(),
              data.path("equation_depth").asInt(),
              data.path("context_tex").asText(""));
      String mathMl = success && data.hasNonNull("mathMl") ? data.get("mathMl").asText() : null;
      outcomes.add(
          new ParseOutcome(success, equation, data.path("errorMessage").asText(""), mathMl));
    }
    return outcomes;
  }

  private void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
    }
  }
}
