package com.branchat.backend.chat.api;

import com.branchat.backend.chat.provider.model.GenerationOptions;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;

@Schema(description = "Optional sampling overrides.")
public record GenerationRequestOptions(
    @Schema(description = "Sampling temperature.", example = "0.7")
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        Double temperature,
    @Schema(description = "Maximum tokens of the answer.", example = "1024") @Positive
        Integer maxTokens) {

  public static GenerationOptions toOptions(GenerationRequestOptions options) {
    return options != null
        ? new GenerationOptions(options.temperature(), options.maxTokens())
        : GenerationOptions.empty();
  }
}
