package com.flamingo.ai.doclinker.domain.model;

import java.util.List;
import java.util.Objects;

/** Per-page collaborator output for a whole document, in page order. Null pages are dropped. */
public record DocumentInput(DocumentMetadata metadata, List<PageInput> pages) {

  public DocumentInput {
    pages = pages == null ? List.of() : pages.stream().filter(Objects::nonNull).toList();
  }
}
