package com.flamingo.ai.entities.service.symbols.table;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Row of the parse results log. One per equation, whether or not it parsed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({
  "arxiv_id",
  "success",
  "equation_index",
  "tex_path",
  "equation",
  "errorMessage"
})
public class ParseResultRow {

  @JsonProperty("arxiv_id")
  private String documentId;

  @JsonProperty("success")
  private boolean success;

  @JsonProperty("equation_index")
  private int equationIndex;

  @JsonProperty("tex_path")
  private String texPath;

  @JsonProperty("equation")
  private String equation;

  @JsonProperty("errorMessage")
  private String errorMessage;
}
