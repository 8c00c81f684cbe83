package com.linelist.cleaner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable tabular dataset with uniquely named, equally sized columns. Replacing a column returns
 * a new table; the original is never touched.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class DataTable {

  private final String name;
  private final Map<String, DataColumn> columns;

  private DataTable(String name, Map<String, DataColumn> columns) {
    this.name = name;
    this.columns = Collections.unmodifiableMap(columns);
  }

  public static DataTable of(String name, List<DataColumn> columns) {
    Map<String, DataColumn> byName = new LinkedHashMap<>();
    Integer rows = null;
    for (DataColumn column : columns) {
      if (byName.containsKey(column.getName())) {
        throw new IllegalArgumentException("Duplicate column name: " + column.getName());
      }
      if (rows != null && rows != column.size()) {
        throw new IllegalArgumentException(
            String.format(
                "Column '%s' has %d rows, expected %d", column.getName(), column.size(), rows));
      }
      rows = column.size();
      byName.put(column.getName(), column);
    }
    return new DataTable(name, byName);
  }

  public static DataTable of(List<DataColumn> columns) {
    return of(null, columns);
  }

  public List<String> getColumnNames() {
    return new ArrayList<>(columns.keySet());
  }

  public int columnCount() {
    return columns.size();
  }

  public int rowCount() {
    return columns.isEmpty() ? 0 : columns.values().iterator().next().size();
  }

  public boolean hasColumn(String columnName) {
    return columns.containsKey(columnName);
  }

  public Optional<DataColumn> findColumn(String columnName) {
    return Optional.ofNullable(columns.get(columnName));
  }

  public DataColumn column(String columnName) {
    DataColumn column = columns.get(columnName);
    if (column == null) {
      throw new IllegalArgumentException("No such column: " + columnName);
    }
    return column;
  }

  /** Returns a copy of this table with the named column replaced, keeping column order. */
  public DataTable withColumn(DataColumn replacement) {
    if (!columns.containsKey(replacement.getName())) {
      throw new IllegalArgumentException("No such column: " + replacement.getName());
    }
    Map<String, DataColumn> copy = new LinkedHashMap<>(columns);
    copy.put(replacement.getName(), replacement);
    return new DataTable(name, copy);
  }

  /** Row-oriented view, one ordered map per row. */
  public List<Map<String, Object>> toRows() {
    List<Map<String, Object>> rows = new ArrayList<>(rowCount());
    for (int i = 0; i < rowCount(); i++) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (DataColumn column : columns.values()) {
        row.put(column.getName(), column.getValues().get(i));
      }
      rows.add(row);
    }
    return rows;
  }
}
