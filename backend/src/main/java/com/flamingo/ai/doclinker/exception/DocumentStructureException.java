package com.flamingo.ai.doclinker.exception;

/**
 * Thrown when a linked document would violate a structural invariant, such as two figure records
 * sharing an identifier and type after grouping. Indicates a defect in the linker, never bad
 * input.
 */
public class DocumentStructureException extends RuntimeException {

  private final String documentTitle;
  private final String userMessage;

  public DocumentStructureException(String documentTitle, String message) {
    super(message);
    this.documentTitle = documentTitle;
    this.userMessage = "Failed to link document structure";
  }

  public DocumentStructureException(String documentTitle, String message, Throwable cause) {
    super(message, cause);
    this.documentTitle = documentTitle;
    this.userMessage = "Failed to link document structure";
  }

  public String getDocumentTitle() {
    return documentTitle;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
