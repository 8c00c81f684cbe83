package com.linelist.cleaner.service.cleaning;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.linelist.cleaner.dto.cleaning.CleaningDiagnostics;
import com.linelist.cleaner.dto.cleaning.ColumnDiagnostic;
import com.linelist.cleaner.dto.cleaning.SpellingIssue;
import com.linelist.cleaner.service.spelling.SubstitutionResult;

@DisplayName("DiagnosticsAggregatorService Tests")
class DiagnosticsAggregatorServiceTest {

  private DiagnosticsAggregatorService service;

  @BeforeEach
  void setUp() {
    service = new DiagnosticsAggregatorService();
  }

  @Test
  @DisplayName("Should pad labels to a common width and replace spaces")
  void shouldBuildLabels() {
    Map<String, String> labels = service.labelsFor(List.of("sex", "date of onset"));

    assertThat(labels).containsEntry("sex", "sex__________");
    assertThat(labels).containsEntry("date of onset", "date_of_onset");
  }

  @Test
  @DisplayName("Should merge both passes of a column and keep iteration order")
  void shouldMergeInIterationOrder() {
    // Given
    DiagnosticsAggregatorService.RunDiagnostics run =
        service.collector(List.of("sym", "grp"), true);

    // When
    run.record("grp", SubstitutionResult.unchanged(List.of(SpellingIssue.unmatched("zz", 1))));
    run.record("sym", SubstitutionResult.unchanged(List.of(SpellingIssue.unmatched("xx", 3))));
    run.record(
        "sym", SubstitutionResult.rejected(SpellingIssue.malformedWordlist("bad wordlist")));
    Optional<CleaningDiagnostics> report = run.finish();

    // Then
    assertThat(report).isPresent();
    assertThat(report.get().getColumns())
        .extracting(ColumnDiagnostic::getColumn)
        .containsExactly("sym", "grp");
    assertThat(report.get().warningCount()).isEqualTo(2);
    assertThat(report.get().errorCount()).isEqualTo(1);
    assertThat(report.get().getMessage())
        .startsWith("Spelling cleaning found 2 warning(s) and 1 error(s) in 2 column(s)")
        .contains("sym: 'xx' was not found in the wordlist (3 occurrences)")
        .contains("grp: 'zz' was not found in the wordlist")
        .contains("Errors:\n    sym: bad wordlist");
  }

  @Test
  @DisplayName("Should report nothing when disabled")
  void shouldDiscardWhenDisabled() {
    DiagnosticsAggregatorService.RunDiagnostics run = service.collector(List.of("sym"), false);

    run.record("sym", SubstitutionResult.unchanged(List.of(SpellingIssue.unmatched("xx", 1))));

    assertThat(run.finish()).isEmpty();
  }

  @Test
  @DisplayName("Should report nothing when every column was clean")
  void shouldReportNothingForCleanRun() {
    DiagnosticsAggregatorService.RunDiagnostics run = service.collector(List.of("sym"), true);

    run.record("sym", SubstitutionResult.unchanged(List.of()));

    assertThat(run.finish()).isEmpty();
  }
}
