package com.linelist.cleaner.service.spelling;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.linelist.cleaner.dto.cleaning.SpellingIssue;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.Wordlist;

@DisplayName("WordlistSpellingService Tests")
class WordlistSpellingServiceTest {

  private WordlistSpellingService service;

  @BeforeEach
  void setUp() {
    service = new WordlistSpellingService();
  }

  private static Wordlist wordlist(String... keysAndValues) {
    List<List<String>> rows = new ArrayList<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      rows.add(Arrays.asList(keysAndValues[i], keysAndValues[i + 1]));
    }
    return Wordlist.of(List.of("options", "values"), rows);
  }

  private static DataColumn text(String... values) {
    return DataColumn.of("col", ColumnKind.TEXT, Arrays.asList(values));
  }

  @Nested
  @DisplayName("Exact key matching")
  class ExactKeyMatching {

    @Test
    @DisplayName("Should replace every matching value")
    void shouldReplaceMatchingValues() {
      // Given
      DataColumn column = text("y", "n", "u");

      // When
      SubstitutionResult result =
          service.apply(column, wordlist("y", "yes", "n", "no", "u", "unknown"));

      // Then
      assertThat(result.getValues()).contains(List.of("yes", "no", "unknown"));
      assertThat(result.getWarnings()).isEmpty();
      assertThat(result.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Should warn once per distinct unmatched value with its count")
    void shouldWarnOncePerUnmatchedValue() {
      DataColumn column = text("y", "xx", "xx", "zz");

      SubstitutionResult result = service.apply(column, wordlist("y", "yes"));

      assertThat(result.getValues()).contains(List.of("yes", "xx", "xx", "zz"));
      assertThat(result.getWarnings())
          .extracting(SpellingIssue::getValue)
          .containsExactly("xx", "zz");
      assertThat(result.getWarnings().get(0).getOccurrences()).isEqualTo(2);
      assertThat(result.getWarnings().get(0).getMessage())
          .isEqualTo("'xx' was not found in the wordlist");
      assertThat(result.getWarnings().get(0).getSeverity())
          .isEqualTo(SpellingIssue.Severity.WARNING);
    }

    @Test
    @DisplayName("Should report no values when nothing changes")
    void shouldReportUnchangedColumn() {
      SubstitutionResult result = service.apply(text("a", "b"), wordlist("y", "yes"));

      assertThat(result.getValues()).isEmpty();
      assertThat(result.getWarnings()).hasSize(2);
    }

    @Test
    @DisplayName("Should match case-sensitively")
    void shouldMatchCaseSensitively() {
      SubstitutionResult result = service.apply(text("Y", "y"), wordlist("y", "yes"));

      assertThat(result.getValues()).contains(List.of("Y", "yes"));
      assertThat(result.getWarnings()).extracting(SpellingIssue::getValue).containsExactly("Y");
    }
  }

  @Nested
  @DisplayName("Reserved keys")
  class ReservedKeyHandling {

    @Test
    @DisplayName("Should map every unmatched value to the .default value")
    void shouldApplyDefault() {
      DataColumn column = text("1", "2", "3");

      SubstitutionResult result =
          service.apply(column, wordlist("1", "Yes", ".default", "Unknown"));

      assertThat(result.getValues()).contains(List.of("Yes", "Unknown", "Unknown"));
      assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should keep values that are already canonical out of .default")
    void shouldNotApplyDefaultToCanonicalValues() {
      DataColumn column = text("Yes", "Unknown", "2");

      SubstitutionResult result =
          service.apply(column, wordlist("1", "Yes", ".default", "Unknown"));

      assertThat(result.getValues()).contains(List.of("Yes", "Unknown", "Unknown"));
      assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should not warn about canonical values when nothing changes")
    void shouldNotWarnForCanonicalValues() {
      DataColumn column = text("yes", "no", "yes");

      SubstitutionResult result = service.apply(column, wordlist("y", "yes", "n", "no"));

      assertThat(result.getValues()).isEmpty();
      assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should leave missing cells alone even with .default")
    void shouldNotApplyDefaultToMissing() {
      DataColumn column = text("1", null, "");

      SubstitutionResult result = service.apply(column, wordlist(".default", "Other"));

      assertThat(result.getValues()).contains(Arrays.asList("Other", null, ""));
      assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Should map missing cells through .missing")
    void shouldApplyMissing() {
      DataColumn column = text("y", null, " ");

      SubstitutionResult result =
          service.apply(column, wordlist("y", "yes", ".missing", "not recorded"));

      assertThat(result.getValues()).contains(List.of("yes", "not recorded", "not recorded"));
    }
  }

  @Nested
  @DisplayName("Malformed wordlists")
  class MalformedWordlists {

    @Test
    @DisplayName("Should reject a single column wordlist")
    void shouldRejectSingleColumnWordlist() {
      Wordlist narrow = Wordlist.of(List.of("options"), List.of(List.of("y")));

      SubstitutionResult result = service.apply(text("y"), narrow);

      assertThat(result.getValues()).isEmpty();
      assertThat(result.getErrors()).hasSize(1);
      assertThat(result.getErrors().get(0).getSeverity()).isEqualTo(SpellingIssue.Severity.ERROR);
      assertThat(result.getErrors().get(0).getMessage()).contains("at least two columns");
    }

    @Test
    @DisplayName("Should reject duplicated keys with conflicting values")
    void shouldRejectConflictingKeys() {
      SubstitutionResult result = service.apply(text("y"), wordlist("y", "yes", "y", "no"));

      assertThat(result.getValues()).isEmpty();
      assertThat(result.getErrors().get(0).getMessage())
          .isEqualTo("duplicated keys with conflicting values: y");
    }

    @Test
    @DisplayName("Should accept duplicated keys that agree")
    void shouldAcceptAgreeingDuplicates() {
      SubstitutionResult result = service.apply(text("y"), wordlist("y", "yes", "y", "yes"));

      assertThat(result.getValues()).contains(List.of("yes"));
      assertThat(result.getErrors()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Categorical levels")
  class CategoricalLevels {

    @Test
    @DisplayName("Should order levels by the wordlist's canonical order")
    void shouldOrderLevelsByWordlist() {
      DataColumn column =
          DataColumn.categorical("sex", List.of("m", "f", "m"), List.of("m", "f"));

      SubstitutionResult result = service.apply(column, wordlist("f", "female", "m", "male"));

      assertThat(result.getValues()).contains(List.of("male", "female", "male"));
      assertThat(result.getLevels()).containsExactly("female", "male");
    }

    @Test
    @DisplayName("Should keep previous levels the wordlist did not produce")
    void shouldKeepUnmappedLevels() {
      DataColumn column =
          DataColumn.categorical("sex", List.of("m", "x", "m"), List.of("x", "m"));

      SubstitutionResult result = service.apply(column, wordlist("m", "male"));

      assertThat(result.getLevels()).containsExactly("male", "x");
    }

    @Test
    @DisplayName("Should not produce levels for text columns")
    void shouldNotProduceLevelsForText() {
      SubstitutionResult result = service.apply(text("m"), wordlist("m", "male"));

      assertThat(result.getLevels()).isNull();
    }
  }
}
