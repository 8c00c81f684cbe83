package com.linelist.cleaner.service.classification;

import java.util.Map;

import com.linelist.cleaner.model.ColumnKind;
import com.linelist.cleaner.model.DataTable;

/** Decides which columns of a dataset are text, categorical or something else. */
public interface ColumnKindClassifier {

  /** Kind of every column, keyed by column name in dataset order. */
  Map<String, ColumnKind> classify(DataTable table);
}
