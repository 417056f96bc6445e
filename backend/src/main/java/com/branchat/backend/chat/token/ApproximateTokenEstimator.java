package com.branchat.backend.chat.token;

import org.springframework.stereotype.Component;

/** Length based estimate: one token per four characters, rounded up. */
@Component
public class ApproximateTokenEstimator implements TokenEstimator {

  private static final int CHARACTERS_PER_TOKEN = 4;

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + CHARACTERS_PER_TOKEN - 1) / CHARACTERS_PER_TOKEN;
  }
}
