package com.linelist.cleaner.service.cleaning;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.exception.WordlistConfigurationException;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataTable;
import com.linelist.cleaner.model.DictionaryBundle;
import com.linelist.cleaner.model.GroupReference;
import com.linelist.cleaner.model.NamedWordlist;
import com.linelist.cleaner.model.ReservedKeys;
import com.linelist.cleaner.model.TableCollectionBundle;
import com.linelist.cleaner.model.Wordlist;

import lombok.extern.slf4j.Slf4j;

/** Up-front checks of a cleaning run. Every method either returns or throws; nothing is changed. */
@Slf4j
@Service
public class WordlistValidationService {

  static final String BAD_DATASET = "x must be a data frame with at least one column";
  static final String BAD_WORDLISTS =
      "wordlists must be a wordlist or a non-empty list of wordlists";
  static final String BAD_ENTRY =
      "everything in wordlists must be a wordlist with at least two columns";
  static final String BAD_GROUP =
      "spelling_vars must be the name or position of a column in the wordlist";
  static final String UNNAMED = "all dictionaries must be named";
  static final String UNMATCHED = "all dictionaries must match a column in the data";
  static final String DEFAULT_WITH_GLOBAL = "the .default keyword cannot be used with .global";

  public void validateDataset(DataTable x) {
    if (x == null || x.columnCount() == 0) {
      throw new WordlistConfigurationException(BAD_DATASET);
    }
  }

  public void validateKinds(DataTable x, Map<String, ColumnKind> kinds) {
    if (kinds == null) {
      return;
    }
    for (Map.Entry<String, ColumnKind> entry : kinds.entrySet()) {
      if (!x.hasColumn(entry.getKey())) {
        throw new WordlistConfigurationException(
            "column kinds refer to a column that is not in the data: " + entry.getKey());
      }
      if (entry.getValue() == null) {
        throw new WordlistConfigurationException("no kind given for column " + entry.getKey());
      }
    }
  }

  /**
   * Checks the shape of {@code wordlists} against the options and the eligible dataset columns,
   * including the ban on {@code .default} keys in any wordlist that acts globally.
   */
  public void validateBundle(
      DictionaryBundle wordlists, GroupReference groupReference, Collection<String> eligible) {
    if (wordlists == null) {
      throw new WordlistConfigurationException(BAD_WORDLISTS);
    }
    switch (wordlists.getShape()) {
      case SINGLE_TABLE:
        validateSingleTable(wordlists.asSingleTable().getWordlist(), groupReference);
        break;
      case TABLE_COLLECTION:
        validateCollection(wordlists.asCollection(), eligible);
        break;
      default:
        throw new IllegalStateException("Unknown bundle shape: " + wordlists.getShape());
    }
  }

  private void validateSingleTable(Wordlist wordlist, GroupReference groupReference) {
    if (wordlist == null) {
      throw new WordlistConfigurationException(BAD_WORDLISTS);
    }
    requireWellFormed(wordlist);

    if (groupReference == null || groupReference.isNone()) {
      if (wordlist.containsKey(ReservedKeys.DEFAULT)) {
        throw new WordlistConfigurationException(DEFAULT_WITH_GLOBAL);
      }
      return;
    }

    int groupColumn =
        groupReference
            .resolve(wordlist)
            .orElseThrow(
                () ->
                    new WordlistConfigurationException(
                        BAD_GROUP + " (got " + groupReference + ")"));
    Wordlist globalRows =
        wordlist.filter(row -> ReservedKeys.GLOBAL.equals(row.get(groupColumn)));
    if (globalRows.containsKey(ReservedKeys.DEFAULT)) {
      throw new WordlistConfigurationException(DEFAULT_WITH_GLOBAL);
    }
  }

  private void validateCollection(TableCollectionBundle bundle, Collection<String> eligible) {
    List<NamedWordlist> entries = bundle.getEntries();
    if (entries.isEmpty()) {
      throw new WordlistConfigurationException(BAD_WORDLISTS);
    }
    for (NamedWordlist entry : entries) {
      if (entry.getWordlist() == null || entry.getWordlist().columnCount() < 2) {
        throw new WordlistConfigurationException(BAD_ENTRY);
      }
    }

    Set<String> seen = new HashSet<>();
    for (NamedWordlist entry : entries) {
      String name = entry.getName();
      if (name == null || name.isBlank()) {
        throw new WordlistConfigurationException(UNNAMED);
      }
      if (!seen.add(name)) {
        throw new WordlistConfigurationException("dictionary names must be unique: " + name);
      }
    }

    for (NamedWordlist entry : entries) {
      if (!entry.isGlobal() && !eligible.contains(entry.getName())) {
        throw new WordlistConfigurationException(UNMATCHED + " (" + entry.getName() + ")");
      }
    }

    for (NamedWordlist entry : entries) {
      if (entry.isGlobal() && entry.getWordlist().containsKey(ReservedKeys.DEFAULT)) {
        throw new WordlistConfigurationException(DEFAULT_WITH_GLOBAL);
      }
    }
    log.debug(
        "Validated {} wordlists against {} eligible columns", entries.size(), eligible.size());
  }

  private void requireWellFormed(Wordlist wordlist) {
    if (wordlist.columnCount() < 2) {
      throw new WordlistConfigurationException(BAD_ENTRY);
    }
  }
}
