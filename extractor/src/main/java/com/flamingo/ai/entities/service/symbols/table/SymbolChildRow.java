package com.flamingo.ai.entities.service.symbols.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Containment of one symbol in another within the same equation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"tex_path", "equation_index", "equation", "symbol_index", "child_index"})
public class SymbolChildRow {

  @JsonProperty("tex_path")
  private String texPath;

  @JsonProperty("equation_index")
  private int equationIndex;

  @JsonProperty("equation")
  private String equation;

  @JsonProperty("symbol_index")
  private int symbolIndex;

  @JsonProperty("child_index")
  private int childIndex;
}
