package com.linelist.cleaner.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Entry of a {@link TableCollectionBundle}. The name may be missing; validation rejects that. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public final class NamedWordlist {

  private final String name;
  private final Wordlist wordlist;

  public boolean isGlobal() {
    return ReservedKeys.GLOBAL.equals(name);
  }
}
