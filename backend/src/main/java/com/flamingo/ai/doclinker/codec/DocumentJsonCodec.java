package com.flamingo.ai.doclinker.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.doclinker.domain.model.DocumentInput;
import com.flamingo.ai.doclinker.domain.model.StructuredDocument;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Reads linker input and writes linked documents as JSON. */
@Component
@RequiredArgsConstructor
public class DocumentJsonCodec {

  private final ObjectMapper objectMapper;

  public DocumentInput readInput(Path path) {
    try {
      return objectMapper.readValue(path.toFile(), DocumentInput.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read document input from " + path, e);
    }
  }

  public DocumentInput readInput(String json) {
    try {
      return objectMapper.readValue(json, DocumentInput.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse document input", e);
    }
  }

  public String write(StructuredDocument document) {
    try {
      return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(document);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize linked document", e);
    }
  }

  public void write(StructuredDocument document, Path path) {
    try {
      Files.writeString(path, write(document));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write linked document to " + path, e);
    }
  }
}
