package com.branchat.backend.memory.service;

import com.branchat.backend.shared.text.KeywordExtractor;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fuzzy term matching over the summary and keyword fields of a memory entry. Each field is scored
 * by the share of query terms it matches, where an exact match counts fully and a match within the
 * allowed edit distance counts partially. The entry score is the best boosted field score.
 */
final class LexicalScorer {

  static final double SUMMARY_BOOST = 2.0d;
  static final double KEYWORDS_BOOST = 1.5d;

  private LexicalScorer() {}

  static double score(String query, String summary, List<String> keywords) {
    Set<String> terms = new LinkedHashSet<>(KeywordExtractor.tokenize(query));
    if (terms.isEmpty()) {
      return 0.0d;
    }
    List<String> summaryTokens = KeywordExtractor.tokenize(summary);
    List<String> keywordTokens =
        KeywordExtractor.tokenize(keywords != null ? String.join(" ", keywords) : "");
    double summaryScore = fieldScore(terms, summaryTokens) * SUMMARY_BOOST;
    double keywordScore = fieldScore(terms, keywordTokens) * KEYWORDS_BOOST;
    return Math.max(summaryScore, keywordScore);
  }

  private static double fieldScore(Set<String> terms, List<String> tokens) {
    if (tokens.isEmpty()) {
      return 0.0d;
    }
    double total = 0.0d;
    for (String term : terms) {
      total += termScore(term, tokens);
    }
    return total / terms.size();
  }

  private static double termScore(String term, List<String> tokens) {
    int allowed = allowedEdits(term.length());
    double best = 0.0d;
    for (String token : tokens) {
      if (token.equals(term)) {
        return 1.0d;
      }
      if (allowed == 0 || Math.abs(token.length() - term.length()) > allowed) {
        continue;
      }
      int distance = editDistance(term, token, allowed);
      if (distance <= allowed) {
        best = Math.max(best, 1.0d - (double) distance / (term.length() + 1));
      }
    }
    return best;
  }

  /** Edits tolerated for a term: none up to two characters, one up to five, two beyond. */
  static int allowedEdits(int termLength) {
    if (termLength <= 2) {
      return 0;
    }
    return termLength <= 5 ? 1 : 2;
  }

  /** Levenshtein distance, abandoning early once every path exceeds {@code limit}. */
  static int editDistance(String left, String right, int limit) {
    int[] previous = new int[right.length() + 1];
    int[] current = new int[right.length() + 1];
    for (int j = 0; j <= right.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= left.length(); i++) {
      current[0] = i;
      int rowMinimum = current[0];
      for (int j = 1; j <= right.length(); j++) {
        int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
        rowMinimum = Math.min(rowMinimum, current[j]);
      }
      if (rowMinimum > limit) {
        return limit + 1;
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[right.length()];
  }
}
