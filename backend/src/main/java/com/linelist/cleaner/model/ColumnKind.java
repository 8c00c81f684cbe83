package com.linelist.cleaner.model;

/** Declared or inferred kind of a dataset column. */
public enum ColumnKind {
  TEXT,
  CATEGORICAL,
  NUMERIC,
  DATE,
  LOGICAL,
  OTHER;

  /** Only text and categorical columns are rewritten; everything else is protected. */
  public boolean isEligible() {
    return this == TEXT || this == CATEGORICAL;
  }
}
