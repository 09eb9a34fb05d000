package com.flamingo.ai.entities.service.symbols;

import com.flamingo.ai.entities.config.ExtractorConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Resolves the per-document directories this stage reads from and writes to. Each document has its
 * own subdirectory in every stage directory, which is what keeps concurrent documents apart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentDirectories {

  static final String ENTITIES_FILE = "entities.csv";

  private final ExtractorConfig extractorConfig;

  public Path equationsFile(String documentId) {
    return stageDirectory(extractorConfig.getDirectories().getDetectedEquations())
        .resolve(documentId)
        .resolve(ENTITIES_FILE);
  }

  public Path equationTokensDirectory(String documentId) {
    return stageDirectory(extractorConfig.getDirectories().getEquationTokens()).resolve(documentId);
  }

  public Path symbolsDirectory(String documentId) {
    return stageDirectory(extractorConfig.getDirectories().getSymbols()).resolve(documentId);
  }

  /** Removes everything a previous run wrote for the document. */
  public void clearOutput(String documentId) {
    for (Path directory :
        List.of(equationTokensDirectory(documentId), symbolsDirectory(documentId))) {
      try {
        if (FileSystemUtils.deleteRecursively(directory)) {
          log.debug("Cleared previous output in {}", directory);
        }
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to clear " + directory, e);
      }
    }
  }

  /** Lists the documents the upstream stage detected equations for, sorted by id. */
  public List<String> detectedDocumentIds() {
    Path detected = stageDirectory(extractorConfig.getDirectories().getDetectedEquations());
    if (!Files.isDirectory(detected)) {
      log.warn("Directory of detected equations {} does not exist", detected);
      return List.of();
    }
    try (Stream<Path> children = Files.list(detected)) {
      return children
          .filter(Files::isDirectory)
          .map(path -> path.getFileName().toString())
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + detected, e);
    }
  }

  private Path stageDirectory(String name) {
    return Path.of(extractorConfig.getDataDirectory(), name);
  }
}
