package com.linelist.cleaner.service.classification;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.cobber.fta.TextAnalysisResult;
import com.cobber.fta.TextAnalyzer;
import com.cobber.fta.core.FTAType;
import com.linelist.cleaner.config.ApplicationProperties;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.DataTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Uses declared column kinds where present and lets FTA infer the base type of the rest. Boolean
 * columns coded as 1/0, yes/no or y/n stay text so that survey codes remain eligible for recoding.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FtaColumnKindClassifier implements ColumnKindClassifier {

  private static final String TRUE_FALSE_MODIFIER = "TRUE_FALSE";

  private final ApplicationProperties applicationProperties;

  @Override
  public Map<String, ColumnKind> classify(DataTable table) {
    Map<String, ColumnKind> kinds = new LinkedHashMap<>();
    for (DataColumn column : table.getColumns().values()) {
      ColumnKind kind = column.isDeclared() ? column.getKind() : infer(column);
      kinds.put(column.getName(), kind);
    }
    log.debug("Column kinds for table '{}': {}", table.getName(), kinds);
    return kinds;
  }

  ColumnKind infer(DataColumn column) {
    if (column.getValues().stream().allMatch(v -> v == null || v.isBlank())) {
      return ColumnKind.TEXT;
    }

    TextAnalysisResult result;
    try {
      TextAnalyzer analyzer = new TextAnalyzer(column.getName());
      analyzer.configure(TextAnalyzer.Feature.DEFAULT_SEMANTIC_TYPES, false);
      analyzer.setDetectWindow(applicationProperties.getClassification().getDetectWindow());
      for (String value : column.getValues()) {
        analyzer.train(value);
      }
      result = analyzer.getResult();
    } catch (Exception e) {
      log.warn(
          "Type inference failed for column '{}', treating it as protected: {}",
          column.getName(),
          e.getMessage());
      return ColumnKind.OTHER;
    }

    FTAType type = result.getType();
    if (type == null) {
      return ColumnKind.OTHER;
    }
    switch (type) {
      case STRING:
        return ColumnKind.TEXT;
      case LONG:
      case DOUBLE:
        return ColumnKind.NUMERIC;
      case BOOLEAN:
        return booleanKind(result.getTypeModifier());
      case LOCALDATE:
      case LOCALTIME:
      case LOCALDATETIME:
      case OFFSETDATETIME:
      case ZONEDDATETIME:
        return ColumnKind.DATE;
      default:
        return ColumnKind.OTHER;
    }
  }

  private ColumnKind booleanKind(String modifier) {
    if (TRUE_FALSE_MODIFIER.equals(modifier)) {
      return ColumnKind.LOGICAL;
    }
    return ColumnKind.TEXT;
  }
}
