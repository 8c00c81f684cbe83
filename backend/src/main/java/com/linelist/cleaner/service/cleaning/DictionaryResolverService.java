package com.linelist.cleaner.service.cleaning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.model.DictionaryBundle;
import com.linelist.cleaner.model.GroupReference;
import com.linelist.cleaner.model.NamedWordlist;
import com.linelist.cleaner.model.ReservedKeys;
import com.linelist.cleaner.model.TableCollectionBundle;
import com.linelist.cleaner.model.Wordlist;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a validated {@link DictionaryBundle} into a {@link ResolvedDictionary}: sorts wordlists,
 * splits a grouped wordlist, separates the {@code .global} wordlist and fixes the column order.
 */
@Slf4j
@Service
public class DictionaryResolverService {

  public ResolvedDictionary resolve(
      DictionaryBundle wordlists,
      GroupReference groupReference,
      String sortBy,
      List<String> eligibleColumns) {
    switch (wordlists.getShape()) {
      case SINGLE_TABLE:
        return resolveSingleTable(
            wordlists.asSingleTable().getWordlist(), groupReference, sortBy, eligibleColumns);
      case TABLE_COLLECTION:
        return resolveCollection(wordlists.asCollection(), sortBy, eligibleColumns);
      default:
        throw new IllegalStateException("Unknown bundle shape: " + wordlists.getShape());
    }
  }

  private ResolvedDictionary resolveSingleTable(
      Wordlist wordlist,
      GroupReference groupReference,
      String sortBy,
      List<String> eligibleColumns) {
    Wordlist sorted = sortBy != null ? wordlist.sortedBy(sortBy) : wordlist;

    if (groupReference == null || groupReference.isNone()) {
      log.warn("Using wordlist globally across all text/categorical columns");
      return ResolvedDictionary.shared(sorted, eligibleColumns);
    }

    int groupColumn =
        groupReference
            .resolve(sorted)
            .orElseThrow(
                () -> new IllegalStateException("Unvalidated group reference " + groupReference));
    Map<String, Wordlist> groups = sorted.split(groupColumn);
    Wordlist global = groups.remove(ReservedKeys.GLOBAL);

    Map<String, Wordlist> specific = new LinkedHashMap<>();
    groups.forEach(
        (group, table) -> {
          if (eligibleColumns.contains(group)) {
            specific.put(group, table);
          } else {
            log.debug("Ignoring wordlist group '{}': no eligible column of that name", group);
          }
        });
    return perColumn(specific, global, eligibleColumns);
  }

  private ResolvedDictionary resolveCollection(
      TableCollectionBundle bundle, String sortBy, List<String> eligibleColumns) {
    Map<String, Wordlist> specific = new LinkedHashMap<>();
    Wordlist global = null;
    for (NamedWordlist entry : bundle.getEntries()) {
      Wordlist table = entry.getWordlist();
      if (sortBy != null) {
        table = table.sortedBy(sortBy);
      }
      if (entry.isGlobal()) {
        global = table;
      } else {
        specific.put(entry.getName(), table);
      }
    }
    return perColumn(specific, global, eligibleColumns);
  }

  /**
   * Columns with a specific wordlist come first in wordlist order; with a global wordlist every
   * other eligible column follows in dataset order.
   */
  private ResolvedDictionary perColumn(
      Map<String, Wordlist> specific, Wordlist global, List<String> eligibleColumns) {
    Set<String> toIterate = new LinkedHashSet<>();
    for (String column : specific.keySet()) {
      if (eligibleColumns.contains(column)) {
        toIterate.add(column);
      }
    }
    if (global != null) {
      toIterate.addAll(eligibleColumns);
    }
    log.debug(
        "Resolved {} column-specific wordlists (global: {}), iterating {}",
        specific.size(),
        global != null,
        toIterate);
    return ResolvedDictionary.perColumn(specific, global, new ArrayList<>(toIterate));
  }
}
