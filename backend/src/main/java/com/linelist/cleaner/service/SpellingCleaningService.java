package com.linelist.cleaner.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.config.ApplicationProperties;
import com.linelist.cleaner.dto.cleaning.SpellingCleaningRequest;
import com.linelist.cleaner.dto.cleaning.SpellingCleaningResponse;
import com.linelist.cleaner.dto.cleaning.SpellingCleaningResponse.ProcessingMetadata;
import com.linelist.cleaner.exception.WordlistConfigurationException;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.DataTable;
import com.linelist.cleaner.model.DictionaryBundle;
import com.linelist.cleaner.model.GroupReference;
import com.linelist.cleaner.model.NamedWordlist;
import com.linelist.cleaner.model.SingleTableBundle;
import com.linelist.cleaner.model.TableCollectionBundle;
import com.linelist.cleaner.model.Wordlist;
import com.linelist.cleaner.service.cleaning.CleaningResult;
import com.linelist.cleaner.service.cleaning.SpellingCleaningOptions;
import com.linelist.cleaner.service.cleaning.VariableSpellingService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Translates JSON requests into a cleaning run and the run back into a response. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpellingCleaningService {

  private final VariableSpellingService variableSpellingService;
  private final ApplicationProperties applicationProperties;

  public SpellingCleaningResponse clean(SpellingCleaningRequest request) {
    DataTable table = toDataTable(request);
    DictionaryBundle bundle = toBundle(request);
    SpellingCleaningOptions options =
        SpellingCleaningOptions.builder()
            .groupReference(
                Boolean.TRUE.equals(request.getUseGlobally())
                    ? GroupReference.none()
                    : GroupReference.parse(
                        request.getSpellingVars() != null
                            ? request.getSpellingVars()
                            : applicationProperties.getDefaults().getSpellingVars()))
            .sortBy(request.getSortBy())
            .kinds(request.getColumnKinds())
            .reportDiagnostics(
                request.getWarn() != null
                    ? request.getWarn()
                    : applicationProperties.getDefaults().isWarn())
            .build();
    return clean(table, bundle, options);
  }

  public SpellingCleaningResponse clean(
      DataTable table, DictionaryBundle bundle, SpellingCleaningOptions options) {
    long startTime = System.currentTimeMillis();
    CleaningResult result = variableSpellingService.cleanVariableSpelling(table, bundle, options);
    DataTable cleaned = result.getData();

    Map<String, List<String>> levels = new LinkedHashMap<>();
    for (DataColumn column : cleaned.getColumns().values()) {
      if (column.getLevels() != null) {
        levels.put(column.getName(), column.getLevels());
      }
    }

    return SpellingCleaningResponse.builder()
        .tableName(cleaned.getName())
        .columns(cleaned.getColumnNames())
        .columnKinds(result.getColumnKinds())
        .data(cleaned.toRows())
        .levels(levels.isEmpty() ? null : levels)
        .diagnostics(result.getDiagnostics().orElse(null))
        .processingMetadata(
            ProcessingMetadata.builder()
                .totalColumns(cleaned.columnCount())
                .processedColumns(result.getProcessedColumns())
                .totalRows(cleaned.rowCount())
                .processingTimeMs(System.currentTimeMillis() - startTime)
                .build())
        .build();
  }

  /**
   * Columns whose cells all arrive as JSON strings are text, all numbers numeric and all booleans
   * logical. Mixed or empty columns stay undeclared and go through inference.
   */
  DataTable toDataTable(SpellingCleaningRequest request) {
    List<DataColumn> columns = new ArrayList<>(request.getColumns().size());
    for (String name : request.getColumns()) {
      List<Object> raw = new ArrayList<>(request.getData().size());
      List<String> values = new ArrayList<>(request.getData().size());
      for (Map<String, Object> row : request.getData()) {
        Object cell = row.get(name);
        raw.add(cell);
        values.add(toCell(cell));
      }
      ColumnKind kind = jsonKind(raw);
      columns.add(
          kind != null ? DataColumn.of(name, kind, values) : DataColumn.undeclared(name, values));
    }
    return DataTable.of(request.getTableName(), columns);
  }

  private ColumnKind jsonKind(List<Object> cells) {
    List<Object> present = cells.stream().filter(Objects::nonNull).collect(Collectors.toList());
    if (present.isEmpty()) {
      return null;
    }
    if (present.stream().allMatch(String.class::isInstance)) {
      return ColumnKind.TEXT;
    }
    if (present.stream().allMatch(Number.class::isInstance)) {
      return ColumnKind.NUMERIC;
    }
    if (present.stream().allMatch(Boolean.class::isInstance)) {
      return ColumnKind.LOGICAL;
    }
    return null;
  }

  DictionaryBundle toBundle(SpellingCleaningRequest request) {
    boolean hasSingle = request.getWordlist() != null;
    boolean hasCollection = request.getWordlists() != null;
    if (hasSingle && hasCollection) {
      throw new WordlistConfigurationException(
          "provide either a single wordlist or a collection of wordlists, not both");
    }
    if (hasSingle) {
      return SingleTableBundle.of(toWordlist(request.getWordlist(), request.getWordlistColumns()));
    }
    if (!hasCollection) {
      throw new WordlistConfigurationException(
          "wordlists must be a wordlist or a non-empty list of wordlists");
    }
    List<NamedWordlist> entries = new ArrayList<>();
    request
        .getWordlists()
        .forEach((name, rows) -> entries.add(NamedWordlist.of(name, toWordlist(rows, null))));
    return TableCollectionBundle.of(entries);
  }

  private Wordlist toWordlist(List<Map<String, Object>> rows, List<String> columnOrder) {
    List<String> columns;
    if (columnOrder != null && !columnOrder.isEmpty()) {
      columns = columnOrder;
    } else {
      LinkedHashSet<String> seen = new LinkedHashSet<>();
      for (Map<String, Object> row : rows) {
        seen.addAll(row.keySet());
      }
      columns = new ArrayList<>(seen);
    }
    List<List<String>> cells = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      List<String> line = new ArrayList<>(columns.size());
      for (String column : columns) {
        line.add(toCell(row.get(column)));
      }
      cells.add(line);
    }
    return Wordlist.of(columns, cells);
  }

  private String toCell(Object value) {
    return value != null ? value.toString() : null;
  }
}
