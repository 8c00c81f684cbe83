package com.linelist.cleaner.model;

/**
 * The set of wordlists supplied to one cleaning run. Implementations form a closed set, tagged by
 * {@link Shape}; callers switch on the tag instead of inspecting runtime types.
 */
public interface DictionaryBundle {

  enum Shape {
    /** One wordlist, split per column through a group column or applied globally. */
    SINGLE_TABLE,
    /** Named wordlists, one per column, plus an optional {@code .global} entry. */
    TABLE_COLLECTION
  }

  Shape getShape();

  default SingleTableBundle asSingleTable() {
    throw new IllegalStateException("Bundle shape is " + getShape() + ", not SINGLE_TABLE");
  }

  default TableCollectionBundle asCollection() {
    throw new IllegalStateException("Bundle shape is " + getShape() + ", not TABLE_COLLECTION");
  }
}
