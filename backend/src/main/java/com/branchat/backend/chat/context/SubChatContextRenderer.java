package com.branchat.backend.chat.context;

import com.branchat.backend.chat.domain.SubChatSummaryMarker;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Renders merged sub-conversation summaries into a single system block. */
@Component
public class SubChatContextRenderer {

  static final String DEFAULT_SELECTED_TEXT = "General discussion";
  static final String DEFAULT_SUMMARY = "Discussion occurred";

  public ContextBlock render(List<SubChatSummaryMarker> markers) {
    if (markers == null || markers.isEmpty()) {
      return null;
    }
    List<String> sections = new ArrayList<>(markers.size());
    for (int i = 0; i < markers.size(); i++) {
      SubChatSummaryMarker marker = markers.get(i);
      String selectedText =
          marker.selectedText() != null ? marker.selectedText() : DEFAULT_SELECTED_TEXT;
      String summary = marker.summary() != null ? marker.summary() : DEFAULT_SUMMARY;
      String details = marker.detailedSummary() != null ? marker.detailedSummary() : summary;
      sections.add(
          "SubChat "
              + (i + 1)
              + ": \""
              + selectedText
              + "\"\nSummary: "
              + summary
              + "\nDetails: "
              + details);
    }
    String content =
        "SUBCHAT CONTEXT: You have "
            + markers.size()
            + " detailed SubChat discussion(s):\n\n"
            + String.join("\n\n", sections)
            + "\n\nUse this context to provide informed responses about these topics.";
    return new ContextBlock(content, markers.size());
  }
}
