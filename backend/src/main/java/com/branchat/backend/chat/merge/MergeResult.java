package com.branchat.backend.chat.merge;

import com.branchat.backend.chat.domain.SubChatStatus;
import com.branchat.backend.chat.provider.model.StructuredSummary;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a completed merge.
 *
 * @param summaryDegraded the model answer could not be parsed and the summary was derived from its
 *     raw text
 * @param contextMarkerId id of the recorded context marker, {@code null} when none was written
 * @param memoryStored whether the summary reached long-term memory
 */
public record MergeResult(
    UUID subChatId,
    UUID conversationId,
    SubChatStatus status,
    Instant resolvedAt,
    StructuredSummary summary,
    boolean summaryDegraded,
    UUID injectedMessageId,
    String injectedContent,
    Instant injectedAt,
    UUID contextMarkerId,
    boolean memoryStored) {}
