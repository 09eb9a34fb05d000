package com.flamingo.ai.entities.service.symbols.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Membership of a token in a symbol. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"tex_path", "equation_index", "symbol_index", "token_index"})
public class SymbolTokenRow {

  @JsonProperty("tex_path")
  private String texPath;

  @JsonProperty("equation_index")
  private int equationIndex;

  @JsonProperty("symbol_index")
  private int symbolIndex;

  @JsonProperty("token_index")
  private int tokenIndex;
}
