package com.branchat.backend.chat.context;

/**
 * Running token estimate of one assembly call. Tier gates are expressed as fractions of the
 * maximum budget.
 */
final class ContextBudget {

  static final double SEMANTIC_ATTEMPT = 0.5;
  static final double SEMANTIC_STOP = 0.6;
  static final double SUBCHAT_ATTEMPT = 0.7;
  static final double SUBCHAT_KEEP = 0.8;
  static final double PREVIOUS_ATTEMPT = 0.85;
  static final double PREVIOUS_KEEP = 0.95;

  private final int maxTokens;
  private int estimatedTokens;

  ContextBudget(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  int maxTokens() {
    return maxTokens;
  }

  int estimatedTokens() {
    return estimatedTokens;
  }

  void add(int tokens) {
    estimatedTokens += Math.max(tokens, 0);
  }

  /** {@code true} while the current estimate is strictly below the given share of the budget. */
  boolean isBelow(double fraction) {
    return estimatedTokens < maxTokens * fraction;
  }

  /** {@code true} when adding {@code tokens} keeps the estimate strictly below the given share. */
  boolean fitsBelow(int tokens, double fraction) {
    return estimatedTokens + tokens < maxTokens * fraction;
  }

  boolean isExhausted() {
    return estimatedTokens >= maxTokens;
  }
}
