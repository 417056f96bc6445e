package com.branchat.backend.chat.api;

import com.branchat.backend.chat.context.ContextMetadata;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.UUID;

@Schema(description = "Accepted streaming turn; tokens follow on the client's event stream.")
public record StreamMessageResponse(
    String clientId, UUID streamId, MessageResponse userMessage, ContextMetadata context) {}
