package com.linelist.cleaner.service.cleaning;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.linelist.cleaner.dto.cleaning.CleaningDiagnostics;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataTable;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Cleaned dataset of one run, the kinds each column was treated as, the columns that went through
 * at least one wordlist, and the consolidated diagnostics when they were requested and non-empty.
 */
@RequiredArgsConstructor
public class CleaningResult {

  @Getter private final DataTable data;
  @Getter private final Map<String, ColumnKind> columnKinds;
  @Getter private final List<String> processedColumns;
  private final CleaningDiagnostics diagnostics;

  public Optional<CleaningDiagnostics> getDiagnostics() {
    return Optional.ofNullable(diagnostics);
  }
}
