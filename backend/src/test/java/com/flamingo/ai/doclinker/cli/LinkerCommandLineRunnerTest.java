package com.flamingo.ai.doclinker.cli;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.doclinker.codec.DocumentJsonCodec;
import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.model.DocumentInput;
import com.flamingo.ai.doclinker.domain.model.DocumentMetadata;
import com.flamingo.ai.doclinker.domain.model.MappingStatistics;
import com.flamingo.ai.doclinker.domain.model.ProcessingInfo;
import com.flamingo.ai.doclinker.domain.model.StructuredDocument;
import com.flamingo.ai.doclinker.exception.DocumentStructureException;
import com.flamingo.ai.doclinker.service.linker.DocumentStructureLinker;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LinkerCommandLineRunnerTest {

  @Mock private DocumentStructureLinker linker;
  @Mock private DocumentJsonCodec codec;

  private LinkerConfig linkerConfig;
  private LinkerCommandLineRunner runner;

  private final DocumentInput input = new DocumentInput(DocumentMetadata.untitled(0), List.of());
  private final StructuredDocument linked =
      new StructuredDocument(
          DocumentMetadata.untitled(0),
          List.of(),
          List.of(),
          MappingStatistics.of(0, 0),
          Map.of(),
          new ProcessingInfo(0, 0, 0, 0, 0, 0));

  @BeforeEach
  void setUp() {
    linkerConfig = new LinkerConfig();
    linkerConfig.getCli().setInput("in.json");
    runner = new LinkerCommandLineRunner(linker, codec, linkerConfig);
  }

  @Test
  void shouldWriteLinkedDocumentToConfiguredOutput() {
    linkerConfig.getCli().setOutput("out.json");
    when(codec.readInput(Path.of("in.json"))).thenReturn(input);
    when(linker.link(input)).thenReturn(linked);

    runner.run();

    verify(codec).write(linked, Path.of("out.json"));
  }

  @Test
  void shouldOnlyLogWithoutOutputPath() {
    when(codec.readInput(Path.of("in.json"))).thenReturn(input);
    when(linker.link(input)).thenReturn(linked);

    runner.run();

    verify(codec, never()).write(any(StructuredDocument.class), any(Path.class));
  }

  @Test
  void shouldPropagateLinkingFailures() {
    when(codec.readInput(Path.of("in.json"))).thenReturn(input);
    when(linker.link(input)).thenThrow(new DocumentStructureException("", "duplicate"));

    assertThatThrownBy(() -> runner.run()).isInstanceOf(DocumentStructureException.class);
  }
}
