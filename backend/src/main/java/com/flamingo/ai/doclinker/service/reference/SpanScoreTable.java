package com.flamingo.ai.doclinker.service.reference;

import com.flamingo.ai.doclinker.domain.model.TextBlock;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/** Classifier backed by precomputed span scores delivered with the page input. */
public class SpanScoreTable implements ReferenceSpanClassifier {

  private final Map<String, Double> scores;

  public SpanScoreTable(Map<String, Double> scores) {
    this.scores =
        scores.entrySet().stream()
            .collect(
                Collectors.toMap(
                    entry -> key(entry.getKey()), Map.Entry::getValue, (first, second) -> first));
  }

  @Override
  public OptionalDouble probability(String spanText, TextBlock block) {
    Double score = scores.get(key(spanText));
    return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
  }

  private static String key(String span) {
    return span.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
