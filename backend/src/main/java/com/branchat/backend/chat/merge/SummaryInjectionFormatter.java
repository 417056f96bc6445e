package com.branchat.backend.chat.merge;

import com.branchat.backend.chat.provider.model.StructuredSummary;
import java.util.List;
import org.springframework.stereotype.Component;

/** Formats a merged summary as the assistant message injected into the parent conversation. */
@Component
public class SummaryInjectionFormatter {

  public String format(StructuredSummary summary) {
    StringBuilder content = new StringBuilder("## Sub-chat Summary\n\n").append(summary.summary());
    appendNumbered(content, "Actions Taken", summary.actions());
    appendNumbered(content, "Artifacts Created", summary.artifacts());
    if (!summary.keywords().isEmpty()) {
      content.append("\n\n### Key Topics\n").append(String.join(", ", summary.keywords()));
    }
    return content.toString();
  }

  private void appendNumbered(StringBuilder content, String heading, List<String> items) {
    if (items.isEmpty()) {
      return;
    }
    content.append("\n\n### ").append(heading).append('\n');
    for (int i = 0; i < items.size(); i++) {
      content.append(i + 1).append(". ").append(items.get(i)).append('\n');
    }
  }
}
