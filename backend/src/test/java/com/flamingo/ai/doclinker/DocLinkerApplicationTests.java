package com.flamingo.ai.doclinker;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.doclinker.cli.LinkerCommandLineRunner;
import com.flamingo.ai.doclinker.codec.DocumentJsonCodec;
import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.model.DocumentInput;
import com.flamingo.ai.doclinker.domain.model.DocumentMetadata;
import com.flamingo.ai.doclinker.domain.model.PageInput;
import com.flamingo.ai.doclinker.domain.model.PageSize;
import com.flamingo.ai.doclinker.domain.model.StructuredDocument;
import com.flamingo.ai.doclinker.service.linker.DocumentStructureLinker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/** Verifies that the application context wires the linker with its configuration. */
@SpringBootTest
class DocLinkerApplicationTests {

  @Autowired private ApplicationContext applicationContext;
  @Autowired private DocumentStructureLinker linker;
  @Autowired private LinkerConfig linkerConfig;
  @Autowired private MeterRegistry meterRegistry;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
    assertThat(applicationContext.getBean(DocumentJsonCodec.class)).isNotNull();
    assertThat(applicationContext.getBeansOfType(LinkerCommandLineRunner.class)).isEmpty();
  }

  @Test
  @DisplayName("Configuration should be bound from application.yml")
  void shouldBindConfiguration() {
    assertThat(linkerConfig.getMapping().getMatchThreshold()).isEqualTo(0.5);
    assertThat(linkerConfig.getCaption().getSearchFactor()).isEqualTo(1.5);
    assertThat(linkerConfig.getVocabulary().getKeywords()).containsKey("figure");
  }

  @Test
  @DisplayName("Linking through the context should record a timer")
  void shouldLinkThroughContext() {
    PageInput page =
        new PageInput(
            0,
            new PageSize(612, 792),
            List.of(LinkerFixtures.block("Table 1 lists the datasets.", 50, 600, 300, 12)),
            List.of(LinkerFixtures.element("t", "Table", 100, 100, 300, 200)));

    StructuredDocument document =
        linker.link(new DocumentInput(new DocumentMetadata("ctx", "", 1), List.of(page)));

    assertThat(document.figures()).hasSize(1);
    assertThat(document.figures().get(0).getFigureId()).isEqualTo("table_unlabeled_1");
    assertThat(meterRegistry.find("linker.document").timer()).isNotNull();
  }
}
