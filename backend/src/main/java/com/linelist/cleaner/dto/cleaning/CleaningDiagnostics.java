package com.linelist.cleaner.dto.cleaning;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Consolidated report of every per-column issue from one cleaning run")
public class CleaningDiagnostics {

  @Builder.Default
  @Schema(description = "Affected columns, in processing order")
  private List<ColumnDiagnostic> columns = new ArrayList<>();

  @Schema(description = "Rendered summary, identical to the logged warning")
  private String message;

  @JsonIgnore
  public int warningCount() {
    return columns.stream().mapToInt(c -> c.getWarnings().size()).sum();
  }

  @JsonIgnore
  public int errorCount() {
    return columns.stream().mapToInt(c -> c.getErrors().size()).sum();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return columns.stream().allMatch(ColumnDiagnostic::isEmpty);
  }
}
