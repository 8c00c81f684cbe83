package com.linelist.cleaner.service.cleaning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.linelist.cleaner.dto.cleaning.CleaningDiagnostics;
import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataColumn;
import com.linelist.cleaner.model.DataTable;
import com.linelist.cleaner.model.DictionaryBundle;
import com.linelist.cleaner.model.Wordlist;
import com.linelist.cleaner.service.classification.ColumnKindClassifier;
import com.linelist.cleaner.service.spelling.SpellingSubstitution;
import com.linelist.cleaner.service.spelling.SubstitutionResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cleans the spelling or codes of several columns at once.
 *
 * <p>Only text and categorical columns are touched. Wordlists are given either as one grouped
 * wordlist, whose group column names the dataset column each row applies to, or as a collection
 * of wordlists named after dataset columns. A wordlist named (or grouped as) {@code .global} is
 * applied to every eligible column; column-specific definitions override global ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VariableSpellingService {

  private final WordlistValidationService validationService;
  private final DictionaryResolverService resolverService;
  private final DiagnosticsAggregatorService diagnosticsService;
  private final ColumnKindClassifier kindClassifier;
  private final SpellingSubstitution substitution;

  public CleaningResult cleanVariableSpelling(DataTable x, DictionaryBundle wordlists) {
    return cleanVariableSpelling(x, wordlists, SpellingCleaningOptions.defaults());
  }

  public CleaningResult cleanVariableSpelling(
      DataTable x, DictionaryBundle wordlists, SpellingCleaningOptions options) {
    long startTime = System.currentTimeMillis();

    validationService.validateDataset(x);
    validationService.validateKinds(x, options.getKinds());
    Map<String, ColumnKind> kinds = resolveKinds(x, options.getKinds());
    List<String> eligible = new ArrayList<>();
    kinds.forEach(
        (column, kind) -> {
          if (kind.isEligible()) {
            eligible.add(column);
          }
        });

    validationService.validateBundle(wordlists, options.getGroupReference(), eligible);
    ResolvedDictionary dictionary =
        resolverService.resolve(
            wordlists, options.getGroupReference(), options.getSortBy(), eligible);

    log.info(
        "Cleaning spelling of table '{}': {} of {} columns eligible, {} to process ({} mode)",
        x.getName(),
        eligible.size(),
        x.columnCount(),
        dictionary.getColumnsToIterate().size(),
        dictionary.getMode());

    DiagnosticsAggregatorService.RunDiagnostics diagnostics =
        diagnosticsService.collector(
            dictionary.getColumnsToIterate(), options.isReportDiagnostics());

    DataTable cleaned = x;
    int passes = 0;
    for (String name : dictionary.getColumnsToIterate()) {
      DataColumn column = x.column(name);
      ColumnKind kind = kinds.get(name);
      if (column.getKind() != kind) {
        column = column.withKind(kind);
      }
      for (Wordlist pass : planPasses(dictionary, name)) {
        SubstitutionResult result = substitution.apply(column, pass);
        Optional<List<String>> values = result.getValues();
        if (values.isPresent()) {
          column = column.withValues(values.get(), result.getLevels());
        }
        diagnostics.record(name, result);
        passes++;
      }
      cleaned = cleaned.withColumn(column);
    }

    Optional<CleaningDiagnostics> report = diagnostics.finish();
    log.info(
        "Finished cleaning table '{}': {} wordlist passes in {} ms",
        x.getName(),
        passes,
        System.currentTimeMillis() - startTime);
    return new CleaningResult(
        cleaned, kinds, dictionary.getColumnsToIterate(), report.orElse(null));
  }

  /**
   * Wordlists to apply to {@code column}, in order. With both a specific and a global wordlist the
   * global rows whose keys the specific wordlist does not define run first, then the specific
   * wordlist in full, so that column-specific definitions always win.
   */
  public List<Wordlist> planPasses(ResolvedDictionary dictionary, String column) {
    List<Wordlist> passes = new ArrayList<>(2);
    if (dictionary.getMode() == ResolvedDictionary.Mode.SHARED_TABLE) {
      dictionary.sharedTable().ifPresent(passes::add);
      return passes;
    }

    Optional<Wordlist> specific = dictionary.specificTable(column);
    Optional<Wordlist> global = dictionary.globalTable();
    if (specific.isPresent() && global.isPresent()) {
      Wordlist remainder = global.get().excludingKeys(specific.get().keys());
      if (!remainder.isEmpty()) {
        passes.add(remainder);
      }
      passes.add(specific.get());
    } else if (specific.isPresent()) {
      passes.add(specific.get());
    } else {
      global.ifPresent(passes::add);
    }
    log.debug("Column '{}': {} wordlist pass(es)", column, passes.size());
    return passes;
  }

  private Map<String, ColumnKind> resolveKinds(DataTable x, Map<String, ColumnKind> explicit) {
    Map<String, ColumnKind> kinds = new LinkedHashMap<>();
    if (explicit != null && explicit.keySet().containsAll(x.getColumnNames())) {
      for (String name : x.getColumnNames()) {
        kinds.put(name, explicit.get(name));
      }
      return kinds;
    }
    kinds.putAll(kindClassifier.classify(x));
    if (explicit != null) {
      kinds.putAll(explicit);
    }
    return kinds;
  }
}
