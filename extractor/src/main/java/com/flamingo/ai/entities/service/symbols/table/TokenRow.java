package com.flamingo.ai.entities.service.symbols.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the token table. Each distinct token of an equation appears once, however many symbols
 * cover it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
  "tex_path",
  "id",
  "equation_index",
  "token_index",
  "start",
  "end",
  "relative_start",
  "relative_end",
  "tex",
  "context_tex",
  "text",
  "equation",
  "equation_depth"
})
public class TokenRow {

  @JsonProperty("tex_path")
  private String texPath;

  /** {@code <equation index>-<token index>}. */
  @JsonProperty("id")
  private String id;

  @JsonProperty("equation_index")
  private int equationIndex;

  @JsonProperty("token_index")
  private int tokenIndex;

  @JsonProperty("start")
  private int start;

  @JsonProperty("end")
  private int end;

  @JsonProperty("relative_start")
  private int relativeStart;

  @JsonProperty("relative_end")
  private int relativeEnd;

  /** Equation TeX between the token's offsets. */
  @JsonProperty("tex")
  private String tex;

  @JsonProperty("context_tex")
  private String contextTex;

  /** Token text as reported by the parser. */
  @JsonProperty("text")
  private String text;

  @JsonProperty("equation")
  private String equation;

  @JsonProperty("equation_depth")
  private int equationDepth;
}
