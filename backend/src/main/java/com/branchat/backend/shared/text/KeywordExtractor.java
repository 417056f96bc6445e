package com.branchat.backend.shared.text;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Heuristic keyword extraction used when a model response cannot be parsed into a structured
 * summary. Keeps words longer than three characters that are not common English function words, in
 * order of first appearance.
 */
public final class KeywordExtractor {

  public static final int DEFAULT_LIMIT = 10;

  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int MIN_WORD_LENGTH = 4;

  private static final Set<String> STOP_WORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
          "is", "are", "was", "were", "be", "been", "have", "has", "had", "do", "does", "did",
          "will", "would", "could", "should", "may", "might", "can", "this", "that", "these",
          "those");

  private KeywordExtractor() {}

  public static List<String> extract(String text) {
    return extract(text, DEFAULT_LIMIT);
  }

  public static List<String> extract(String text, int limit) {
    if (!StringUtils.hasText(text) || limit <= 0) {
      return List.of();
    }
    String normalized = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
    Set<String> keywords = new LinkedHashSet<>();
    for (String word : WHITESPACE.split(normalized)) {
      if (word.length() < MIN_WORD_LENGTH || STOP_WORDS.contains(word)) {
        continue;
      }
      keywords.add(word);
      if (keywords.size() >= limit) {
        break;
      }
    }
    return List.copyOf(keywords);
  }

  /** Splits text into lowercase word tokens, used for lexical matching. */
  public static List<String> tokenize(String text) {
    if (!StringUtils.hasText(text)) {
      return List.of();
    }
    String normalized = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    if (normalized.isEmpty()) {
      return List.of();
    }
    return List.of(WHITESPACE.split(normalized));
  }
}
