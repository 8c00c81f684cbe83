package com.linelist.cleaner.service.cleaning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.dto.cleaning.CleaningDiagnostics;
import com.linelist.cleaner.dto.cleaning.ColumnDiagnostic;
import com.linelist.cleaner.dto.cleaning.SpellingIssue;
import com.linelist.cleaner.service.spelling.SubstitutionResult;

import lombok.extern.slf4j.Slf4j;

/** Gathers per-column warnings and errors of a run into one report. */
@Slf4j
@Service
public class DiagnosticsAggregatorService {

  /**
   * Display labels for {@code columns}: every name right-padded to the longest one, then spaces
   * replaced with underscores.
   */
  public Map<String, String> labelsFor(List<String> columns) {
    int width = columns.stream().mapToInt(String::length).max().orElse(0);
    Map<String, String> labels = new LinkedHashMap<>();
    for (String column : columns) {
      labels.put(column, String.format("%-" + Math.max(width, 1) + "s", column).replace(' ', '_'));
    }
    return labels;
  }

  /** Starts collecting for one run. When {@code enabled} is false everything is discarded. */
  public RunDiagnostics collector(List<String> columns, boolean enabled) {
    return new RunDiagnostics(labelsFor(columns), enabled);
  }

  String render(List<ColumnDiagnostic> columns) {
    int warnings = columns.stream().mapToInt(c -> c.getWarnings().size()).sum();
    int errors = columns.stream().mapToInt(c -> c.getErrors().size()).sum();
    StringBuilder message = new StringBuilder();
    message.append(
        String.format(
            "Spelling cleaning found %d warning(s) and %d error(s) in %d column(s)",
            warnings, errors, columns.size()));
    if (warnings > 0) {
      message.append("\n  Warnings:");
      for (ColumnDiagnostic column : columns) {
        for (SpellingIssue issue : column.getWarnings()) {
          message
              .append("\n    ")
              .append(column.getLabel())
              .append(": ")
              .append(issue.getMessage());
          if (issue.getOccurrences() > 1) {
            message.append(" (").append(issue.getOccurrences()).append(" occurrences)");
          }
        }
      }
    }
    if (errors > 0) {
      message.append("\n  Errors:");
      for (ColumnDiagnostic column : columns) {
        for (SpellingIssue issue : column.getErrors()) {
          message
              .append("\n    ")
              .append(column.getLabel())
              .append(": ")
              .append(issue.getMessage());
        }
      }
    }
    return message.toString();
  }

  /** Per-run accumulator. Not thread safe; one instance belongs to one run. */
  public final class RunDiagnostics {

    private final Map<String, String> labels;
    private final boolean enabled;
    private final Map<String, ColumnDiagnostic> byColumn = new LinkedHashMap<>();

    private RunDiagnostics(Map<String, String> labels, boolean enabled) {
      this.labels = labels;
      this.enabled = enabled;
    }

    public void record(String column, SubstitutionResult result) {
      if (!enabled) {
        return;
      }
      ColumnDiagnostic diagnostic =
          byColumn.computeIfAbsent(
              column,
              c ->
                  ColumnDiagnostic.builder()
                      .column(c)
                      .label(labels.getOrDefault(c, c.replace(' ', '_')))
                      .build());
      diagnostic.getWarnings().addAll(result.getWarnings());
      diagnostic.getErrors().addAll(result.getErrors());
    }

    /**
     * Builds the consolidated report and logs it once at WARN level. Empty when collection was
     * disabled or nothing was recorded.
     */
    public Optional<CleaningDiagnostics> finish() {
      if (!enabled) {
        return Optional.empty();
      }
      List<ColumnDiagnostic> affected = new ArrayList<>();
      for (String column : labels.keySet()) {
        ColumnDiagnostic diagnostic = byColumn.get(column);
        if (diagnostic != null && !diagnostic.isEmpty()) {
          affected.add(diagnostic);
        }
      }
      if (affected.isEmpty()) {
        return Optional.empty();
      }
      String message = render(affected);
      log.warn(message);
      return Optional.of(CleaningDiagnostics.builder().columns(affected).message(message).build());
    }
  }
}
