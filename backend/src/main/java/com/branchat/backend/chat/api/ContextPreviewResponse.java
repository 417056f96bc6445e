package com.branchat.backend.chat.api;

import com.branchat.backend.chat.context.ContextMetadata;
import com.branchat.backend.chat.provider.model.PromptMessage;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Ordered context messages and per-source counts.")
public record ContextPreviewResponse(List<PromptMessage> messages, ContextMetadata metadata) {}
