package com.branchat.backend.chat.provider;

import com.branchat.backend.chat.provider.model.StructuredSummary;
import com.branchat.backend.chat.provider.model.StructuredSummaryOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Validates a model answer against the summary schema: a JSON object with a non-blank
 * {@code summary} string and {@code actions}, {@code artifacts} and {@code keywords} arrays of
 * strings. A surrounding Markdown code fence is tolerated.
 */
@Component
public class StructuredSummaryParser {

  private static final String FENCE = "```";

  private final ObjectMapper objectMapper;

  public StructuredSummaryParser(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public StructuredSummaryOutcome parse(String rawResponse) {
    if (!StringUtils.hasText(rawResponse)) {
      return StructuredSummaryOutcome.unparseable(rawResponse, "Response is empty");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(stripFence(rawResponse.trim()));
    } catch (JsonProcessingException exception) {
      return StructuredSummaryOutcome.unparseable(
          rawResponse, "Response is not valid JSON: " + exception.getOriginalMessage());
    }
    if (root == null || !root.isObject()) {
      return StructuredSummaryOutcome.unparseable(rawResponse, "Response is not a JSON object");
    }

    JsonNode summary = root.get("summary");
    if (summary == null || !summary.isTextual() || !StringUtils.hasText(summary.asText())) {
      return StructuredSummaryOutcome.unparseable(rawResponse, "Field 'summary' must be a non-blank string");
    }

    List<String> actions = new ArrayList<>();
    List<String> artifacts = new ArrayList<>();
    List<String> keywords = new ArrayList<>();
    String failure = readStringArray(root, "actions", actions);
    if (failure == null) {
      failure = readStringArray(root, "artifacts", artifacts);
    }
    if (failure == null) {
      failure = readStringArray(root, "keywords", keywords);
    }
    if (failure != null) {
      return StructuredSummaryOutcome.unparseable(rawResponse, failure);
    }

    return StructuredSummaryOutcome.parsed(
        new StructuredSummary(summary.asText().trim(), actions, artifacts, keywords), rawResponse);
  }

  private String readStringArray(JsonNode root, String field, List<String> target) {
    JsonNode node = root.get(field);
    if (node == null || !node.isArray()) {
      return "Field '" + field + "' must be an array";
    }
    for (JsonNode element : node) {
      if (!element.isTextual()) {
        return "Field '" + field + "' must contain only strings";
      }
      if (StringUtils.hasText(element.asText())) {
        target.add(element.asText().trim());
      }
    }
    return null;
  }

  private String stripFence(String text) {
    if (!text.startsWith(FENCE)) {
      return text;
    }
    int firstLineEnd = text.indexOf('\n');
    int closing = text.lastIndexOf(FENCE);
    if (firstLineEnd < 0 || closing <= firstLineEnd) {
      return text;
    }
    return text.substring(firstLineEnd + 1, closing).trim();
  }
}
