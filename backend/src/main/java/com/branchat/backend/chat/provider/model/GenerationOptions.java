package com.branchat.backend.chat.provider.model;

/** Sampling overrides for one generation request. {@code null} keeps the model default. */
public record GenerationOptions(Double temperature, Integer maxTokens) {

  public static GenerationOptions empty() {
    return new GenerationOptions(null, null);
  }

  public GenerationOptions orElse(GenerationOptions defaults) {
    if (defaults == null) {
      return this;
    }
    return new GenerationOptions(
        temperature != null ? temperature : defaults.temperature(),
        maxTokens != null ? maxTokens : defaults.maxTokens());
  }
}
