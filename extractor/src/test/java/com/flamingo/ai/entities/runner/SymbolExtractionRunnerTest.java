package com.flamingo.ai.entities.runner;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.entities.service.symbols.DocumentDirectories;
import com.flamingo.ai.entities.service.symbols.SymbolExtractionService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class SymbolExtractionRunnerTest {

  @Mock private SymbolExtractionService symbolExtractionService;
  @Mock private DocumentDirectories directories;

  private SymbolExtractionRunner runner;

  @BeforeEach
  void setUp() {
    runner = new SymbolExtractionRunner(symbolExtractionService, directories);
  }

  @Test
  void shouldProcessNamedDocuments_whenIdsAreGiven() {
    runner.run(
        new DefaultApplicationArguments(
            "--extractor.parser.throw-on-error=true", "1601.1", "1601.2"));

    verify(symbolExtractionService).extractAll(List.of("1601.1", "1601.2"));
    verifyNoInteractions(directories);
  }

  @Test
  void shouldProcessDetectedDocuments_whenNoIdsAreGiven() {
    when(directories.detectedDocumentIds()).thenReturn(List.of("a", "b"));

    runner.run(new DefaultApplicationArguments());

    verify(symbolExtractionService).extractAll(List.of("a", "b"));
  }

  @Test
  void shouldDoNothing_whenNoDocumentsAreDetected() {
    when(directories.detectedDocumentIds()).thenReturn(List.of());

    runner.run(new DefaultApplicationArguments());

    verify(symbolExtractionService, never()).extractAll(anyList());
  }
}
