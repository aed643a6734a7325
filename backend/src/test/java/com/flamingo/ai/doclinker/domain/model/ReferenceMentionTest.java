package com.flamingo.ai.doclinker.domain.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReferenceMentionTest {

  private ReferenceMention mention;

  @BeforeEach
  void setUp() {
    mention =
        new ReferenceMention(
            "Fig. 2", new BoundingBox(0, 0, 60, 12), 0, CanonicalType.FIGURE, "2", 0.7);
  }

  @Test
  void shouldStartUnresolved() {
    assertThat(mention.isResolved()).isFalse();
    assertThat(mention.getMatchedFigureId()).isNull();
    assertThat(mention.isNotMatched()).isFalse();
  }

  @Test
  void shouldResolveOnlyOnce() {
    mention.resolveTo("2", 0.8);

    assertThat(mention.isResolved()).isTrue();
    assertThatThrownBy(() -> mention.markUnmatched(0.0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Fig. 2");
  }

  @Test
  void shouldKeepBestRejectedScoreWhenUnmatched() {
    mention.markUnmatched(0.3);

    assertThat(mention.isNotMatched()).isTrue();
    assertThat(mention.getMatchScore()).isEqualTo(0.3);
    assertThatThrownBy(() -> mention.resolveTo("2", 0.8)).isInstanceOf(IllegalStateException.class);
  }
}
