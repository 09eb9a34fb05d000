package com.flamingo.ai.entities.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the symbol extraction stage. */
@Configuration
@ConfigurationProperties(prefix = "extractor")
@Getter
@Setter
public class ExtractorConfig {

  /** Root directory holding one subdirectory per pipeline stage. */
  private String dataDirectory = "data";

  /** Process the documents named on the command line (or all detected ones) at startup. */
  private boolean runOnStartup = true;

  private Directories directories = new Directories();
  private Parser parser = new Parser();
  private Workers workers = new Workers();

  /** Names of the stage directories under {@link #dataDirectory}. */
  @Getter
  @Setter
  public static class Directories {
    /** Upstream stage output: {@code <dir>/<documentId>/entities.csv}. */
    private String detectedEquations = "detected-equations";

    /** Parse results log and token table. */
    private String equationTokens = "detected-equation-tokens";

    /** Symbol table and symbol relationship tables. */
    private String symbols = "detected-symbols";
  }

  /** Settings for the external KaTeX-based equation parser. */
  @Getter
  @Setter
  public static class Parser {
    private List<String> command =
        new ArrayList<>(List.of("npm", "--silent", "start", "equations-csv"));

    /** Directory the parser command runs in. Equation paths are passed relative to it. */
    private String workingDirectory = "node";

    /**
     * Abort parsing of an equation on the first error. Leave off to get a partial parse of
     * equations with errors; turn on when diagnosing parse failures.
     */
    private boolean throwOnError = false;

    /** Color KaTeX uses to mark sub-expressions it could not parse. */
    private String errorColor = "#b22222";

    private Duration timeout = Duration.ofMinutes(10);
  }

  @Getter
  @Setter
  public static class Workers {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 1000;
  }
}
