package com.linelist.cleaner.dto.cleaning;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single warning or error raised while recoding one column")
public class SpellingIssue {

  public enum Severity {
    WARNING,
    ERROR
  }

  @Schema(description = "WARNING for unmatched values, ERROR for malformed wordlists")
  private Severity severity;

  @Schema(description = "Offending value, when the issue concerns a single value")
  private String value;

  @Schema(description = "Number of cells holding the offending value")
  private int occurrences;

  @Schema(description = "Human readable description")
  private String message;

  public static SpellingIssue unmatched(String value, int occurrences) {
    return SpellingIssue.builder()
        .severity(Severity.WARNING)
        .value(value)
        .occurrences(occurrences)
        .message(String.format("'%s' was not found in the wordlist", value))
        .build();
  }

  public static SpellingIssue malformedWordlist(String message) {
    return SpellingIssue.builder().severity(Severity.ERROR).message(message).build();
  }
}
