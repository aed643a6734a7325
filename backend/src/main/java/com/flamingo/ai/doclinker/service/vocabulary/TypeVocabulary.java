package com.flamingo.ai.doclinker.service.vocabulary;

import com.flamingo.ai.doclinker.config.LinkerConfig;
import com.flamingo.ai.doclinker.domain.enums.CanonicalType;
import com.flamingo.ai.doclinker.domain.enums.LayoutType;
import com.flamingo.ai.doclinker.domain.model.LayoutElement;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keyword and layout-label vocabularies, and the patterns compiled from them.
 *
 * <p>Both vocabularies come from {@link LinkerConfig.Vocabulary}, so new synonyms (another
 * language, a publisher's house style) are added through configuration rather than code.
 */
@Slf4j
@Component
public class TypeVocabulary {

  /** Dot-separated integers, tolerating whitespace around the dots. */
  public static final String IDENTIFIER = "\\d+(?:\\s*\\.\\s*\\d+)*";

  /** Equation numbering convention: one integer or a dotted pair, short components only. */
  public static final String EQUATION_NUMBER = "\\d{1,3}(?:\\s*\\.\\s*\\d{1,3})?";

  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile(IDENTIFIER);
  private static final Pattern EQUATION_NUMBER_ONLY =
      Pattern.compile("^\\s*\\(\\s*(" + EQUATION_NUMBER + ")\\s*\\)\\s*$");
  private static final Pattern DOT_WITH_SPACES = Pattern.compile("\\s*\\.\\s*");

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private final Map<String, CanonicalType> keywords;
  private final Map<String, LayoutType> layoutLabels;
  private final Pattern captionPattern;
  private final Pattern keywordReferencePattern;
  private final Pattern bareEquationPattern;

  public TypeVocabulary(LinkerConfig linkerConfig) {
    this.keywords = lowerCaseKeys(linkerConfig.getVocabulary().getKeywords());
    this.layoutLabels = lowerCaseKeys(linkerConfig.getVocabulary().getLayoutLabels());

    String keywordAlternation =
        keywords.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

    this.captionPattern =
        Pattern.compile(
            "^\\s*(?<kw>"
                + keywordAlternation
                + ")\\.?\\s*\\(?\\s*(?<id>"
                + IDENTIFIER
                + ")\\s*\\)?(?=[:.]|\\s|$)",
            FLAGS);

    String item = "(?:\\(\\s*" + IDENTIFIER + "\\s*\\)|" + IDENTIFIER + ")";
    this.keywordReferencePattern =
        Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?<kw>"
                + keywordAlternation
                + ")\\.?\\s*(?<ids>"
                + item
                + "(?:\\s*(?:,|&|and|or)\\s*"
                + item
                + ")*)(?![\\p{N}])",
            FLAGS);

    this.bareEquationPattern =
        Pattern.compile("(?<![\\p{L}\\p{N}])\\(\\s*(?<id>" + EQUATION_NUMBER + ")\\s*\\)");

    log.debug(
        "Type vocabulary loaded with {} keywords and {} layout labels",
        keywords.size(),
        layoutLabels.size());
  }

  /** Canonical type for a free-form keyword such as {@code "Fig."} or {@code "Table"}. */
  public Optional<CanonicalType> canonicalTypeOf(String keyword) {
    if (keyword == null) {
      return Optional.empty();
    }
    String key = keyword.trim().toLowerCase(Locale.ROOT);
    if (key.endsWith(".")) {
      key = key.substring(0, key.length() - 1);
    }
    return Optional.ofNullable(keywords.get(key));
  }

  /** Normalized layout type for a detector label; unknown labels become {@link LayoutType#TEXT}. */
  public LayoutType layoutTypeOf(String label) {
    if (label == null) {
      return LayoutType.TEXT;
    }
    return layoutLabels.getOrDefault(label.trim().toLowerCase(Locale.ROOT), LayoutType.TEXT);
  }

  public LayoutType layoutTypeOf(LayoutElement element) {
    return layoutTypeOf(element.type());
  }

  /**
   * Reads a caption such as {@code "Figure 2.6: Document structure"}: a keyword at the start of
   * the text, an optional period, an identifier, then a separator or the end of the text.
   */
  public Optional<DeclaredIdentifier> matchCaption(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    Matcher matcher = captionPattern.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return canonicalTypeOf(matcher.group("kw"))
        .map(
            type ->
                new DeclaredIdentifier(
                    type,
                    normalizeIdentifier(matcher.group("id")),
                    matcher.start("id"),
                    matcher.end("id")));
  }

  /** Reads a stand-alone equation number such as {@code "(1.4)"}. */
  public Optional<DeclaredIdentifier> matchEquationNumber(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = EQUATION_NUMBER_ONLY.matcher(text);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(
        new DeclaredIdentifier(
            CanonicalType.EQUATION,
            normalizeIdentifier(matcher.group(1)),
            matcher.start(1),
            matcher.end(1)));
  }

  /** Pattern for keyword references, with named groups {@code kw} and {@code ids}. */
  public Pattern keywordReferencePattern() {
    return keywordReferencePattern;
  }

  /** Pattern for bare parenthesized equation numbers, with named group {@code id}. */
  public Pattern bareEquationPattern() {
    return bareEquationPattern;
  }

  /** Pattern matching each individual identifier inside an enumeration. */
  public static Pattern identifierPattern() {
    return IDENTIFIER_PATTERN;
  }

  /**
   * Normalizes a dotted identifier: removes whitespace around dots and strips leading zeros from
   * every component, so {@code "02 . 06"} becomes {@code "2.6"}.
   */
  public static String normalizeIdentifier(String raw) {
    if (raw == null) {
      return null;
    }
    String[] parts = DOT_WITH_SPACES.split(raw.trim());
    StringBuilder normalized = new StringBuilder();
    for (String part : parts) {
      String digits = part.trim().replaceFirst("^0+(?=\\d)", "");
      if (normalized.length() > 0) {
        normalized.append('.');
      }
      normalized.append(digits);
    }
    return normalized.toString();
  }

  private static <V> Map<String, V> lowerCaseKeys(Map<String, V> source) {
    Map<String, V> result = new LinkedHashMap<>();
    source.forEach((key, value) -> result.put(key.trim().toLowerCase(Locale.ROOT), value));
    return result;
  }
}
