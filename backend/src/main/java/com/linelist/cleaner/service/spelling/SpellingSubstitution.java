package com.linelist.cleaner.service.spelling;

import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.Wordlist;

/** Recodes a single column with a single wordlist. */
public interface SpellingSubstitution {

  /**
   * Applies {@code wordlist} to the current values of {@code column}. Unmatched values are reported
   * as warnings, structurally invalid wordlists as errors; neither is thrown.
   */
  SubstitutionResult apply(DataColumn column, Wordlist wordlist);
}
