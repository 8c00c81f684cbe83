package com.linelist.cleaner.exception;

/**
 * Raised before any column is touched when the dataset, the wordlists or the options of a
 * cleaning run cannot be used together.
 */
public class WordlistConfigurationException extends IllegalArgumentException {

  public WordlistConfigurationException(String message) {
    super(message);
  }
}
