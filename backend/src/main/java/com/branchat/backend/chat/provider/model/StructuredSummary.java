package com.branchat.backend.chat.provider.model;

import java.util.List;

public record StructuredSummary(
    String summary, List<String> actions, List<String> artifacts, List<String> keywords) {

  public StructuredSummary {
    summary = summary != null ? summary : "";
    actions = actions != null ? List.copyOf(actions) : List.of();
    artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
    keywords = keywords != null ? List.copyOf(keywords) : List.of();
  }
}
