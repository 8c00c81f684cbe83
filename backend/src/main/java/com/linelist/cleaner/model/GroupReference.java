package com.linelist.cleaner.model;

import java.util.Optional;

import lombok.EqualsAndHashCode;

/**
 * Points at the wordlist column that assigns each row to a dataset column, either by name or by
 * 1-based position. {@link #none()} means the single wordlist is applied to every eligible column.
 */
@EqualsAndHashCode
public final class GroupReference {

  public static final int DEFAULT_POSITION = 3;

  private static final GroupReference NONE = new GroupReference(null, null);

  private final String name;
  private final Integer position;

  private GroupReference(String name, Integer position) {
    this.name = name;
    this.position = position;
  }

  public static GroupReference byName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("group column name must not be null");
    }
    return new GroupReference(name, null);
  }

  public static GroupReference byPosition(int position) {
    return new GroupReference(null, position);
  }

  public static GroupReference defaultReference() {
    return byPosition(DEFAULT_POSITION);
  }

  public static GroupReference none() {
    return NONE;
  }

  /**
   * Parses a request parameter: blank means the default position, digits a position, anything
   * else a column name.
   */
  public static GroupReference parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return defaultReference();
    }
    String trimmed = raw.trim();
    if (trimmed.chars().allMatch(Character::isDigit)) {
      return byPosition(Integer.parseInt(trimmed));
    }
    return byName(trimmed);
  }

  public boolean isNone() {
    return name == null && position == null;
  }

  /** Zero-based column index in {@code wordlist}, empty when the reference does not resolve. */
  public Optional<Integer> resolve(Wordlist wordlist) {
    if (name != null) {
      int index = wordlist.indexOf(name);
      return index >= 0 ? Optional.of(index) : Optional.empty();
    }
    if (position != null && position >= 1 && position <= wordlist.columnCount()) {
      return Optional.of(position - 1);
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    if (name != null) {
      return "'" + name + "'";
    }
    return position != null ? String.valueOf(position) : "none";
  }
}
