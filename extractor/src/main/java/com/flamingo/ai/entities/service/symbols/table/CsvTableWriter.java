package com.flamingo.ai.entities.service.symbols.table;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flamingo.ai.entities.exception.TableWriteException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Appends rows to CSV tables. A table gets a header row when its first rows are written; rows
 * already in a table are never rewritten.
 */
@Component
public class CsvTableWriter {

  private final CsvMapper csvMapper;

  public CsvTableWriter() {
    csvMapper = new CsvMapper();
    // Quote only values containing separators, quotes or line breaks; TeX is full of '$' and '+'.
    csvMapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
  }

  /**
   * Appends rows to a table, creating the file and its parent directories if needed.
   *
   * @param table path of the CSV file
   * @param rowType class of the rows, whose property order defines the columns
   * @param rows rows to append; nothing is written if empty
   */
  public <T> void append(Path table, Class<T> rowType, List<T> rows) {
    if (rows.isEmpty()) {
      return;
    }
    try {
      Files.createDirectories(table.getParent());
      boolean needsHeader = !Files.exists(table) || Files.size(table) == 0;
      CsvSchema schema = csvMapper.schemaFor(rowType).withUseHeader(needsHeader);
      try (Writer out =
              Files.newBufferedWriter(
                  table,
                  StandardCharsets.UTF_8,
                  StandardOpenOption.CREATE,
                  StandardOpenOption.APPEND);
          SequenceWriter rowWriter = csvMapper.writer(schema).writeValues(out)) {
        rowWriter.writeAll(rows);
      }
    } catch (IOException e) {
      throw new TableWriteException(table, e);
    }
  }

  /** Creates an empty table if none exists yet, so readers can rely on the file being there. */
  public void ensureExists(Path table) {
    try {
      Files.createDirectories(table.getParent());
      if (!Files.exists(table)) {
        Files.createFile(table);
      }
    } catch (IOException e) {
      throw new TableWriteException(table, e);
    }
  }
}
