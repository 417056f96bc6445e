package com.branchat.backend.chat.token;

/**
 * Approximates the number of model tokens for a piece of text. Implementations are not expected to
 * match a provider tokenizer exactly.
 */
public interface TokenEstimator {

  int estimate(String text);
}
