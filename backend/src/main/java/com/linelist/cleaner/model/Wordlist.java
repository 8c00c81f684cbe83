package com.linelist.cleaner.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Lookup table used to recode one column. Column 1 holds the source keys, column 2 the canonical
 * values; further columns (group, sort order, notes) are carried along untouched.
 *
 * <p>Instances are immutable. Sorting, splitting and filtering return new wordlists.
 */
@ToString
@EqualsAndHashCode
public final class Wordlist {

  public static final int KEY_COLUMN = 0;
  public static final int VALUE_COLUMN = 1;

  private final List<String> columnNames;
  private final List<List<String>> rows;

  private Wordlist(List<String> columnNames, List<List<String>> rows) {
    this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
    List<List<String>> copy = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      if (row.size() != columnNames.size()) {
        throw new IllegalArgumentException(
            String.format(
                "Wordlist row has %d cells but the wordlist has %d columns",
                row.size(), columnNames.size()));
      }
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public static Wordlist of(List<String> columnNames, List<List<String>> rows) {
    Objects.requireNonNull(columnNames, "columnNames");
    Objects.requireNonNull(rows, "rows");
    return new Wordlist(columnNames, rows);
  }

  /** Two-column wordlist built from key/value pairs, in insertion order. */
  public static Wordlist ofPairs(Map<String, String> pairs) {
    List<List<String>> rows = new ArrayList<>();
    pairs.forEach((k, v) -> rows.add(Arrays.asList(k, v)));
    return new Wordlist(List.of("options", "values"), rows);
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public List<List<String>> getRows() {
    return rows;
  }

  public int columnCount() {
    return columnNames.size();
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String columnName) {
    return columnNames.contains(columnName);
  }

  public int indexOf(String columnName) {
    return columnNames.indexOf(columnName);
  }

  public String key(int row) {
    return rows.get(row).get(KEY_COLUMN);
  }

  public String value(int row) {
    return rows.get(row).get(VALUE_COLUMN);
  }

  public List<String> keys() {
    return column(KEY_COLUMN);
  }

  public List<String> column(int index) {
    List<String> cells = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      cells.add(row.get(index));
    }
    return cells;
  }

  public boolean containsKey(String key) {
    for (List<String> row : rows) {
      if (Objects.equals(row.get(KEY_COLUMN), key)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Distinct canonical values in row order. This is the label ordering applied to categorical
   * columns, so sorting the wordlist first controls the resulting level order.
   */
  public List<String> canonicalOrder() {
    LinkedHashSet<String> ordered = new LinkedHashSet<>();
    for (List<String> row : rows) {
      String canonical = row.get(VALUE_COLUMN);
      if (canonical != null) {
        ordered.add(canonical);
      }
    }
    return new ArrayList<>(ordered);
  }

  /**
   * Stable ascending sort on the named column. A wordlist without that column is returned as is.
   */
  public Wordlist sortedBy(String columnName) {
    int index = indexOf(columnName);
    if (index < 0) {
      return this;
    }
    List<List<String>> sorted = new ArrayList<>(rows);
    Comparator<List<String>> byCell =
        Comparator.comparing(row -> row.get(index), SortKeyComparator.INSTANCE);
    sorted.sort(byCell);
    return new Wordlist(columnNames, sorted);
  }

  /** Splits rows by the cells of the given column, groups ordered by first appearance. */
  public Map<String, Wordlist> split(int groupColumn) {
    Map<String, List<List<String>>> grouped = new LinkedHashMap<>();
    for (List<String> row : rows) {
      String group = row.get(groupColumn);
      if (group == null) {
        continue;
      }
      grouped.computeIfAbsent(group, g -> new ArrayList<>()).add(row);
    }
    Map<String, Wordlist> split = new LinkedHashMap<>();
    grouped.forEach((group, groupRows) -> split.put(group, new Wordlist(columnNames, groupRows)));
    return split;
  }

  public Wordlist filter(Predicate<List<String>> keep) {
    List<List<String>> kept = new ArrayList<>();
    for (List<String> row : rows) {
      if (keep.test(row)) {
        kept.add(row);
      }
    }
    return new Wordlist(columnNames, kept);
  }

  /** Rows whose source key is not among {@code keys}. */
  public Wordlist excludingKeys(Collection<String> keys) {
    Set<String> excluded = new HashSet<>(keys);
    return filter(row -> !excluded.contains(row.get(KEY_COLUMN)));
  }
}
