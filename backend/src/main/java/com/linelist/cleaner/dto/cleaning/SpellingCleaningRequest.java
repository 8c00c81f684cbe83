package com.linelist.cleaner.dto.cleaning;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.linelist.cleaner.model.ColumnKind;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpellingCleaningRequest {

  @JsonProperty("table_name")
  private String tableName;

  @NotNull
  @NotEmpty
  @JsonProperty("columns")
  private List<String> columns;

  @NotNull
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  /** Optional explicit kinds; unlisted columns are classified from their values. */
  @JsonProperty("column_kinds")
  private Map<String, ColumnKind> columnKinds;

  /** Single grouped wordlist, one object per row. */
  @JsonProperty("wordlist")
  private List<Map<String, Object>> wordlist;

  /** Column order of {@code wordlist}; defaults to the key order of its rows. */
  @JsonProperty("wordlist_columns")
  private List<String> wordlistColumns;

  /** Wordlists by dataset column name; {@code .global} applies to all eligible columns. */
  @JsonProperty("wordlists")
  private Map<String, List<Map<String, Object>>> wordlists;

  /** Name or 1-based position of the group column of {@code wordlist}. */
  @JsonProperty("spelling_vars")
  private String spellingVars;

  /** Apply {@code wordlist} to every eligible column instead of splitting it. */
  @JsonProperty("use_globally")
  private Boolean useGlobally;

  @JsonProperty("sort_by")
  private String sortBy;

  @JsonProperty("warn")
  private Boolean warn;
}
