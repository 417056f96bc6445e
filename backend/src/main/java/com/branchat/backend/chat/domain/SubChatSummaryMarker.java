package com.branchat.backend.chat.domain;

import java.time.Instant;
import java.util.UUID;
import org.springframework.util.StringUtils;

/**
 * Typed annotation attached to a context marker message. It carries the merged summary of a
 * sub-conversation so that context assembly never has to parse rendered message text.
 */
public record SubChatSummaryMarker(
    UUID subChatId,
    String selectedText,
    String summary,
    String detailedSummary,
    int questionCount,
    Instant mergedAt) {

  public SubChatSummaryMarker {
    selectedText = StringUtils.hasText(selectedText) ? selectedText.trim() : null;
    summary = StringUtils.hasText(summary) ? summary.trim() : null;
    detailedSummary = StringUtils.hasText(detailedSummary) ? detailedSummary.trim() : null;
    questionCount = Math.max(questionCount, 0);
  }
}
