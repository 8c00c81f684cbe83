package com.linelist.cleaner.service.spelling;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.dto.cleaning.SpellingIssue;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.ReservedKeys;
import com.linelist.cleaner.model.Wordlist;

import lombok.extern.slf4j.Slf4j;

/**
 * Exact-key recoding of one column. Besides literal keys the wordlist may define {@code .missing}
 * (replacement for missing cells) and {@code .default} (replacement for any other unmatched value).
 * A value that already equals one of the wordlist's canonical values counts as matched, so a second
 * run over cleaned data changes nothing.
 */
@Slf4j
@Service
public class WordlistSpellingService implements SpellingSubstitution {

  @Override
  public SubstitutionResult apply(DataColumn column, Wordlist wordlist) {
    if (wordlist.columnCount() < 2) {
      return SubstitutionResult.rejected(
          SpellingIssue.malformedWordlist(
              String.format(
                  "wordlist must have at least two columns (keys and values), found %d",
                  wordlist.columnCount())));
    }

    Map<String, String> lookup = new LinkedHashMap<>();
    Set<String> conflicting = new LinkedHashSet<>();
    Set<String> canonicalValues = new HashSet<>();
    for (int i = 0; i < wordlist.rowCount(); i++) {
      String key = wordlist.key(i);
      String canonical = wordlist.value(i);
      if (canonical != null) {
        canonicalValues.add(canonical);
      }
      if (key == null) {
        continue;
      }
      if (lookup.containsKey(key) && !Objects.equals(lookup.get(key), canonical)) {
        conflicting.add(key);
      } else {
        lookup.putIfAbsent(key, canonical);
      }
    }
    if (!conflicting.isEmpty()) {
      return SubstitutionResult.rejected(
          SpellingIssue.malformedWordlist(
              "duplicated keys with conflicting values: " + String.join(", ", conflicting)));
    }

    boolean hasDefault = lookup.containsKey(ReservedKeys.DEFAULT);
    boolean hasMissing = lookup.containsKey(ReservedKeys.MISSING);
    String defaultValue = lookup.get(ReservedKeys.DEFAULT);
    String missingValue = lookup.get(ReservedKeys.MISSING);

    List<String> recoded = new ArrayList<>(column.size());
    Map<String, Integer> unmatched = new LinkedHashMap<>();
    boolean changed = false;
    for (String value : column.getValues()) {
      String replacement;
      if (ReservedKeys.isMissing(value)) {
        replacement = hasMissing ? missingValue : value;
      } else if (lookup.containsKey(value)) {
        replacement = lookup.get(value);
      } else if (canonicalValues.contains(value)) {
        replacement = value;
      } else if (hasDefault) {
        replacement = defaultValue;
      } else {
        replacement = value;
        unmatched.merge(value, 1, Integer::sum);
      }
      changed |= !Objects.equals(replacement, value);
      recoded.add(replacement);
    }

    List<SpellingIssue> warnings = new ArrayList<>();
    unmatched.forEach((value, count) -> warnings.add(SpellingIssue.unmatched(value, count)));

    log.debug(
        "Column '{}': {} wordlist rows, {} distinct unmatched values, changed={}",
        column.getName(),
        wordlist.rowCount(),
        unmatched.size(),
        changed);

    if (!changed) {
      return SubstitutionResult.unchanged(warnings);
    }
    List<String> levels =
        column.getKind() == ColumnKind.CATEGORICAL ? levelsFor(column, recoded, wordlist) : null;
    return SubstitutionResult.builder()
        .values(recoded)
        .levels(levels)
        .warnings(warnings)
        .build();
  }

  /**
   * Canonical values in wordlist order first, then previous levels (and stray values) that the
   * wordlist did not produce. Levels no longer present are dropped.
   */
  private List<String> levelsFor(DataColumn column, List<String> recoded, Wordlist wordlist) {
    Set<String> present = new LinkedHashSet<>();
    for (String value : recoded) {
      if (value != null) {
        present.add(value);
      }
    }
    Set<String> levels = new LinkedHashSet<>();
    for (String canonical : wordlist.canonicalOrder()) {
      if (present.contains(canonical)) {
        levels.add(canonical);
      }
    }
    if (column.getLevels() != null) {
      for (String level : column.getLevels()) {
        if (present.contains(level)) {
          levels.add(level);
        }
      }
    }
    levels.addAll(present);
    return new ArrayList<>(levels);
  }
}
