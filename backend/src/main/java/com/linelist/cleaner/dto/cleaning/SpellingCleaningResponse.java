package com.linelist.cleaner.dto.cleaning;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.linelist.cleaner.model.ColumnKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SpellingCleaningResponse {

  @JsonProperty("table_name")
  private String tableName;

  @JsonProperty("columns")
  private List<String> columns;

  @JsonProperty("column_kinds")
  private Map<String, ColumnKind> columnKinds;

  @JsonProperty("data")
  private List<Map<String, Object>> data;

  /** Level order of categorical columns. */
  @JsonProperty("levels")
  private Map<String, List<String>> levels;

  @JsonProperty("diagnostics")
  private CleaningDiagnostics diagnostics;

  @JsonProperty("processing_metadata")
  private ProcessingMetadata processingMetadata;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ProcessingMetadata {

    @JsonProperty("total_columns")
    private Integer totalColumns;

    @JsonProperty("processed_columns")
    private List<String> processedColumns;

    @JsonProperty("total_rows")
    private Integer totalRows;

    @JsonProperty("processing_time_ms")
    private Long processingTimeMs;
  }
}
