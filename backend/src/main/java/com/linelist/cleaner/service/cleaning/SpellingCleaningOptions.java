package com.linelist.cleaner.service.cleaning;

import java.util.Map;

import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.GroupReference;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Knobs of a cleaning run. The defaults match a plain call with only data and wordlists. */
@Getter
@Builder(toBuilder = true)
@ToString
public class SpellingCleaningOptions {

  /** Group column of a single wordlist; ignored for collections. */
  @Builder.Default private final GroupReference groupReference = GroupReference.defaultReference();

  /** Wordlist column whose ascending order decides categorical level order. */
  private final String sortBy;

  /** Explicit column kinds; columns not listed are classified automatically. */
  private final Map<String, ColumnKind> kinds;

  /** Raise one consolidated warning with every per-column issue. */
  private final boolean reportDiagnostics;

  public static SpellingCleaningOptions defaults() {
    return SpellingCleaningOptions.builder().build();
  }
}
