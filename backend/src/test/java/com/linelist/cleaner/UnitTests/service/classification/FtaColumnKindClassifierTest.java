package com.linelist.cleaner.service.classification;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.linelist.cleaner.config.ApplicationProperties;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.DataTable;

@DisplayName("FtaColumnKindClassifier Tests")
class FtaColumnKindClassifierTest {

  private FtaColumnKindClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new FtaColumnKindClassifier(new ApplicationProperties());
  }

  @Test
  @DisplayName("Should classify free text as TEXT")
  void shouldClassifyText() {
    DataColumn column =
        DataColumn.undeclared(
            "name", List.of("Alice", "Bob", "Carol", "David", "Eve", "Frank", "Grace"));

    assertThat(classifier.infer(column)).isEqualTo(ColumnKind.TEXT);
  }

  @Test
  @DisplayName("Should classify integers as NUMERIC")
  void shouldClassifyNumbers() {
    DataColumn column =
        DataColumn.undeclared("age", List.of("12", "25", "31", "47", "52", "68", "73"));

    assertThat(classifier.infer(column)).isEqualTo(ColumnKind.NUMERIC);
  }

  @Test
  @DisplayName("Should keep 1/0 survey codes as TEXT")
  void shouldClassifyOneZeroCodesAsText() {
    DataColumn column =
        DataColumn.undeclared(
            "treatment_administered",
            Arrays.asList("0", "1", null, "1", "0", "0", "1", "1", "0", "1"));

    assertThat(classifier.infer(column)).isEqualTo(ColumnKind.TEXT);
  }

  @Test
  @DisplayName("Should classify ISO dates as DATE")
  void shouldClassifyDates() {
    DataColumn column =
        DataColumn.undeclared(
            "onset",
            List.of(
                "2023-01-15", "2023-02-20", "2023-03-25", "2023-04-30", "2023-05-05",
                "2023-06-10"));

    assertThat(classifier.infer(column)).isEqualTo(ColumnKind.DATE);
  }

  @Test
  @DisplayName("Should treat an all-missing column as TEXT")
  void shouldTreatEmptyColumnAsText() {
    DataColumn column = DataColumn.undeclared("notes", Arrays.asList(null, "", " "));

    assertThat(classifier.infer(column)).isEqualTo(ColumnKind.TEXT);
  }

  @Test
  @DisplayName("Should keep declared kinds without inference")
  void shouldKeepDeclaredKinds() {
    DataTable table =
        DataTable.of(
            "cases",
            List.of(
                DataColumn.of("code", ColumnKind.CATEGORICAL, List.of("1", "2", "3")),
                DataColumn.undeclared("age", List.of("12", "25", "31", "47", "52"))));

    Map<String, ColumnKind> kinds = classifier.classify(table);

    assertThat(kinds).containsExactly(
        Map.entry("code", ColumnKind.CATEGORICAL), Map.entry("age", ColumnKind.NUMERIC));
  }
}
