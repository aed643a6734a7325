package com.flamingo.ai.doclinker.domain.model;

/**
 * Descriptive document metadata passed through to the output.
 *
 * @param title document title, may be empty
 * @param author document author, may be empty
 * @param pages number of pages
 */
public record DocumentMetadata(String title, String author, Integer pages) {

  public static DocumentMetadata untitled(int pages) {
    return new DocumentMetadata("", "", pages);
  }

  public DocumentMetadata withPages(int count) {
    return new DocumentMetadata(title, author, count);
  }
}
