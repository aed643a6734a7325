package com.flamingo.ai.doclinker.cli;

import com.flamingo.ai.doclinker.codec.DocumentJsonCodec;
import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.model.DocumentInput;
import com.flamingo.ai.doclinker.domain.model.StructuredDocument;
import com.flamingo.ai.doclinker.service.linker.DocumentStructureLinker;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Links a single JSON input file on startup.
 *
 * <p>Active only when {@code linker.cli.input} is set. The result is written to {@code
 * linker.cli.output} when given, otherwise only the summary is logged. Failures propagate and stop
 * the application with a non-zero exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "linker.cli", name = "input")
public class LinkerCommandLineRunner implements CommandLineRunner {

  private final DocumentStructureLinker linker;
  private final DocumentJsonCodec codec;
  private final LinkerConfig linkerConfig;

  @Override
  public void run(String... args) {
    Path input = Path.of(linkerConfig.getCli().getInput());
    log.info("Linking document from {}", input);

    DocumentInput document = codec.readInput(input);
    StructuredDocument linked = linker.link(document);

    String output = linkerConfig.getCli().getOutput();
    if (output == null || output.isBlank()) {
      log.info(
          "No output path configured; {} figures, match rate {}",
          linked.figures().size(),
          linked.mappingStatistics().matchRate());
      return;
    }
    codec.write(linked, Path.of(output));
    log.info("Linked document written to {}", output);
  }
}
