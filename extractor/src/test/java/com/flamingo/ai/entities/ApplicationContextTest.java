package com.flamingo.ai.entities;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.entities.runner.SymbolExtractionRunner;
import com.flamingo.ai.entities.service.symbols.SymbolExtractionService;
import com.flamingo.ai.entities.service.symbols.parser.EquationParser;
import com.flamingo.ai.entities.service.symbols.parser.KatexEquationParser;
import com.flamingo.ai.entities.service.symbols.parser.MathMlSymbolForestExtractor;
import com.flamingo.ai.entities.service.symbols.parser.SymbolForestExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the Spring application context loads. The startup runner is disabled in the test
 * configuration so no documents are processed.
 */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Extraction pipeline beans should be wired to the default implementations")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(SymbolExtractionService.class)).isNotNull();
    assertThat(applicationContext.getBean(EquationParser.class))
        .isInstanceOf(KatexEquationParser.class);
    assertThat(applicationContext.getBean(SymbolForestExtractor.class))
        .isInstanceOf(MathMlSymbolForestExtractor.class);
    assertThat(applicationContext.getBeansOfType(SymbolExtractionRunner.class)).isEmpty();
  }
}
