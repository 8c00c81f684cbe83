package com.linelist.cleaner.service.cleaning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.linelist.cleaner.model.Wordlist;

import lombok.Getter;
import lombok.ToString;

/**
 * Wordlists of one run after validation, sorting and splitting. Exactly one mode holds for the
 * whole run.
 */
@ToString
public final class ResolvedDictionary {

  public enum Mode {
    /** One wordlist applied in full to every eligible column. */
    SHARED_TABLE,
    /** Column-specific wordlists with an optional global fallback. */
    PER_COLUMN
  }

  @Getter private final Mode mode;
  @Getter private final List<String> columnsToIterate;
  private final Wordlist sharedTable;
  private final Map<String, Wordlist> specificTables;
  private final Wordlist globalTable;

  private ResolvedDictionary(
      Mode mode,
      List<String> columnsToIterate,
      Wordlist sharedTable,
      Map<String, Wordlist> specificTables,
      Wordlist globalTable) {
    this.mode = mode;
    this.columnsToIterate = List.copyOf(columnsToIterate);
    this.sharedTable = sharedTable;
    this.specificTables = Collections.unmodifiableMap(new LinkedHashMap<>(specificTables));
    this.globalTable = globalTable;
  }

  static ResolvedDictionary shared(Wordlist table, List<String> columnsToIterate) {
    return new ResolvedDictionary(Mode.SHARED_TABLE, columnsToIterate, table, Map.of(), null);
  }

  static ResolvedDictionary perColumn(
      Map<String, Wordlist> specificTables, Wordlist globalTable, List<String> columnsToIterate) {
    return new ResolvedDictionary(
        Mode.PER_COLUMN, columnsToIterate, null, specificTables, globalTable);
  }

  public Optional<Wordlist> sharedTable() {
    return Optional.ofNullable(sharedTable);
  }

  public Optional<Wordlist> specificTable(String column) {
    return Optional.ofNullable(specificTables.get(column));
  }

  public Optional<Wordlist> globalTable() {
    return Optional.ofNullable(globalTable);
  }

  public Map<String, Wordlist> getSpecificTables() {
    return specificTables;
  }
}
