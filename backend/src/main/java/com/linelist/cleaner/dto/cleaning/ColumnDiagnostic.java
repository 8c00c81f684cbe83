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
@Schema(description = "Warnings and errors collected for one column across all wordlist passes")
public class ColumnDiagnostic {

  @Schema(description = "Dataset column name")
  private String column;

  @Schema(description = "Display label: padded to a common width, spaces replaced by underscores")
  private String label;

  @Builder.Default
  @Schema(description = "Values left unchanged because no key matched them")
  private List<SpellingIssue> warnings = new ArrayList<>();

  @Builder.Default
  @Schema(description = "Malformed-wordlist problems; the affected pass was skipped")
  private List<SpellingIssue> errors = new ArrayList<>();

  @JsonIgnore
  public boolean isEmpty() {
    return warnings.isEmpty() && errors.isEmpty();
  }
}
