package com.linelist.cleaner.service.spelling;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.linelist.cleaner.dto.cleaning.SpellingIssue;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * Outcome of applying one wordlist to one column. {@code values} is absent when nothing changed or
 * when the wordlist was rejected; the caller then keeps the column as it was.
 */
@Getter
@Builder
public class SubstitutionResult {

  private final List<String> values;
  private final List<String> levels;
  @Singular private final List<SpellingIssue> warnings;
  @Singular private final List<SpellingIssue> errors;

  public Optional<List<String>> getValues() {
    return Optional.ofNullable(values);
  }

  public List<String> getLevels() {
    return levels == null ? null : Collections.unmodifiableList(levels);
  }

  public static SubstitutionResult unchanged(List<SpellingIssue> warnings) {
    return SubstitutionResult.builder().warnings(warnings).build();
  }

  public static SubstitutionResult rejected(SpellingIssue error) {
    return SubstitutionResult.builder().error(error).build();
  }
}
