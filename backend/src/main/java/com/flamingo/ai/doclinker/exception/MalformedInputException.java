package com.flamingo.ai.doclinker.exception;

/**
 * Raised for a single text block or layout element that lacks usable geometry. The linker skips
 * the offending item and keeps processing the page.
 */
public class MalformedInputException extends RuntimeException {

  private final int pageIdx;
  private final String itemDescription;

  public MalformedInputException(int pageIdx, String itemDescription, String message) {
    super(message);
    this.pageIdx = pageIdx;
    this.itemDescription = itemDescription;
  }

  public int getPageIdx() {
    return pageIdx;
  }

  public String getItemDescription() {
    return itemDescription;
  }
}
