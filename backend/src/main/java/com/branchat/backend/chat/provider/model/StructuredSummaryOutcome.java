package com.branchat.backend.chat.provider.model;

import java.util.Objects;

/**
 * Result of a structured summarisation request: either a summary that passed schema validation or
 * the raw model answer together with the reason it was rejected.
 */
public record StructuredSummaryOutcome(
    Status status, StructuredSummary summary, String rawResponse, String failureReason) {

  public enum Status {
    PARSED,
    UNPARSEABLE
  }

  public StructuredSummaryOutcome {
    Objects.requireNonNull(status, "status must not be null");
    if (status == Status.PARSED) {
      Objects.requireNonNull(summary, "summary must not be null for parsed outcome");
    }
  }

  public static StructuredSummaryOutcome parsed(StructuredSummary summary, String rawResponse) {
    return new StructuredSummaryOutcome(Status.PARSED, summary, rawResponse, null);
  }

  public static StructuredSummaryOutcome unparseable(String rawResponse, String failureReason) {
    return new StructuredSummaryOutcome(
        Status.UNPARSEABLE, null, rawResponse != null ? rawResponse : "", failureReason);
  }

  public boolean isParsed() {
    return status == Status.PARSED;
  }
}
