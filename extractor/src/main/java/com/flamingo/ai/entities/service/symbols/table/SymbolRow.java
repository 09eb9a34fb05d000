package com.flamingo.ai.entities.service.symbols.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Row of the symbol table. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
  "id",
  "tex_path",
  "equation_index",
  "equation",
  "symbol_index",
  "start",
  "end",
  "tex",
  "context_tex",
  "mathml",
  "is_definition",
  "relative_start",
  "relative_end"
})
public class SymbolRow {

  /** {@code <equation index>-<symbol index>}. */
  @JsonProperty("id")
  private String id;

  @JsonProperty("tex_path")
  private String texPath;

  @JsonProperty("equation_index")
  private int equationIndex;

  @JsonProperty("equation")
  private String equation;

  @JsonProperty("symbol_index")
  private int symbolIndex;

  @JsonProperty("start")
  private int start;

  @JsonProperty("end")
  private int end;

  @JsonProperty("tex")
  private String tex;

  @JsonProperty("context_tex")
  private String contextTex;

  @JsonProperty("mathml")
  private String mathml;

  @JsonProperty("is_definition")
  private boolean definition;

  @JsonProperty("relative_start")
  private int relativeStart;

  @JsonProperty("relative_end")
  private int relativeEnd;
}
