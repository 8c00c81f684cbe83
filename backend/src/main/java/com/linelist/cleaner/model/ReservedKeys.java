package com.linelist.cleaner.model;

/** Keywords with special meaning inside wordlists and dictionary bundles. */
public final class ReservedKeys {

  /** Source key matching any non-missing value that has no exact key. */
  public static final String DEFAULT = ".default";

  /** Source key matching missing cells (null or blank). */
  public static final String MISSING = ".missing";

  /** Group or entry name of the wordlist applied to every eligible column. */
  public static final String GLOBAL = ".global";

  private ReservedKeys() {}

  public static boolean isMissing(String value) {
    return value == null || value.trim().isEmpty();
  }
}
