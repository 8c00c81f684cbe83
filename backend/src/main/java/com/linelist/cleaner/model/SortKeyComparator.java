package com.linelist.cleaner.model;

import java.util.Comparator;

/**
 * Orders wordlist sort-key cells: numbers (including {@code Inf} and {@code -Inf}) ascending and
 * before text, text lexicographically, missing cells last.
 */
final class SortKeyComparator implements Comparator<String> {

  static final SortKeyComparator INSTANCE = new SortKeyComparator();

  private SortKeyComparator() {}

  @Override
  public int compare(String a, String b) {
    boolean aMissing = ReservedKeys.isMissing(a);
    boolean bMissing = ReservedKeys.isMissing(b);
    if (aMissing || bMissing) {
      return Boolean.compare(aMissing, bMissing);
    }
    Double na = parseNumber(a);
    Double nb = parseNumber(b);
    if (na != null && nb != null) {
      return Double.compare(na, nb);
    }
    if (na != null) {
      return -1;
    }
    if (nb != null) {
      return 1;
    }
    return a.compareTo(b);
  }

  static Double parseNumber(String cell) {
    String trimmed = cell.trim();
    switch (trimmed) {
      case "Inf":
      case "+Inf":
        return Double.POSITIVE_INFINITY;
      case "-Inf":
        return Double.NEGATIVE_INFINITY;
      default:
        break;
    }
    try {
      double parsed = Double.parseDouble(trimmed);
      return Double.isNaN(parsed) ? null : parsed;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
