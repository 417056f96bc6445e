package com.branchat.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Metadata recorded with a generated assistant message.")
public record StreamMessageMetadata(
    @Schema(description = "Estimated tokens of the generated text.", example = "182") Integer tokens,
    @Schema(description = "Model identifier.", example = "gpt-4o-mini") String model,
    @Schema(description = "Wall-clock generation time in milliseconds.", example = "2140")
        Long processingTimeMs) {}
