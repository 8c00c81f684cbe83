package com.linelist.cleaner.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** A bundle consisting of a single, possibly grouped, wordlist. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public final class SingleTableBundle implements DictionaryBundle {

  private final Wordlist wordlist;

  @Override
  public Shape getShape() {
    return Shape.SINGLE_TABLE;
  }

  @Override
  public SingleTableBundle asSingleTable() {
    return this;
  }
}
