package com.linelist.cleaner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A single named column of a {@link DataTable}. Cells are strings and {@code null} marks a missing
 * cell. Categorical columns carry an ordered list of levels.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DataColumn {

  private final String name;
  private final ColumnKind kind;
  private final List<String> values;
  private final List<String> levels;

  private DataColumn(String name, ColumnKind kind, List<String> values, List<String> levels) {
    this.name = Objects.requireNonNull(name, "name");
    this.kind = kind;
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
    this.levels = levels == null ? null : Collections.unmodifiableList(new ArrayList<>(levels));
  }

  public static DataColumn of(String name, ColumnKind kind, List<String> values) {
    Objects.requireNonNull(values, "values");
    List<String> levels = kind == ColumnKind.CATEGORICAL ? observedLevels(values) : null;
    return new DataColumn(name, kind, values, levels);
  }

  /** Column without a declared kind; the classifier decides what it is. */
  public static DataColumn undeclared(String name, List<String> values) {
    return of(name, null, values);
  }

  public static DataColumn categorical(String name, List<String> values, List<String> levels) {
    Objects.requireNonNull(values, "values");
    return new DataColumn(
        name, ColumnKind.CATEGORICAL, values, levels != null ? levels : observedLevels(values));
  }

  public int size() {
    return values.size();
  }

  public boolean isDeclared() {
    return kind != null;
  }

  public DataColumn withValues(List<String> newValues, List<String> newLevels) {
    if (newValues.size() != values.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Column '%s' has %d rows, replacement has %d",
              name, values.size(), newValues.size()));
    }
    if (kind == ColumnKind.CATEGORICAL) {
      return new DataColumn(
          name, kind, newValues, newLevels != null ? newLevels : observedLevels(newValues));
    }
    return new DataColumn(name, kind, newValues, null);
  }

  public DataColumn withKind(ColumnKind newKind) {
    if (newKind == ColumnKind.CATEGORICAL && levels == null) {
      return new DataColumn(name, newKind, values, observedLevels(values));
    }
    return new DataColumn(name, newKind, values, newKind == ColumnKind.CATEGORICAL ? levels : null);
  }

  private static List<String> observedLevels(List<String> values) {
    LinkedHashSet<String> seen = new LinkedHashSet<>();
    for (String v : values) {
      if (v != null) {
        seen.add(v);
      }
    }
    return new ArrayList<>(seen);
  }
}
