package com.linelist.cleaner.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Ordered collection of wordlists addressed by dataset column name. */
@ToString
@EqualsAndHashCode
public final class TableCollectionBundle implements DictionaryBundle {

  private final List<NamedWordlist> entries;

  private TableCollectionBundle(List<NamedWordlist> entries) {
    this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
  }

  public static TableCollectionBundle of(List<NamedWordlist> entries) {
    return new TableCollectionBundle(entries);
  }

  public static TableCollectionBundle of(Map<String, Wordlist> wordlists) {
    List<NamedWordlist> entries = new ArrayList<>(wordlists.size());
    wordlists.forEach((name, wordlist) -> entries.add(NamedWordlist.of(name, wordlist)));
    return new TableCollectionBundle(entries);
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<NamedWordlist> getEntries() {
    return entries;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Shape getShape() {
    return Shape.TABLE_COLLECTION;
  }

  @Override
  public TableCollectionBundle asCollection() {
    return this;
  }

  public static final class Builder {
    private final List<NamedWordlist> entries = new ArrayList<>();

    public Builder add(String name, Wordlist wordlist) {
      entries.add(NamedWordlist.of(name, wordlist));
      return this;
    }

    public Builder global(Wordlist wordlist) {
      return add(ReservedKeys.GLOBAL, wordlist);
    }

    public TableCollectionBundle build() {
      return new TableCollectionBundle(entries);
    }
  }
}
