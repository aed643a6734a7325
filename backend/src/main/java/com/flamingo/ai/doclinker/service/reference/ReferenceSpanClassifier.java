package com.flamingo.ai.doclinker.service.reference;

import com.flamingo.ai.doclinker.domain.model.TextBlock;
import java.util.OptionalDouble;

/**
 * Optional upstream model scoring whether a text span is a reference mention.
 *
 * <p>When no implementation is available, or it declines to score a span, the extractor treats
 * the classifier factor as 1.0.
 */
@FunctionalInterface
public interface ReferenceSpanClassifier {

  /** Classifier that never scores anything. */
  ReferenceSpanClassifier NONE = (spanText, block) -> OptionalDouble.empty();

  /**
   * Probability that the span denotes a reference.
   *
   * @param spanText the matched span, e.g. {@code "Fig. 2.6"}
   * @param block the text block containing the span
   * @return probability in [0, 1], or empty when the span was not scored
   */
  OptionalDouble probability(String spanText, TextBlock block);
}
