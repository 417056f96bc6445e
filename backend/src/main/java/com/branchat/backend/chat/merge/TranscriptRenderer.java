package com.branchat.backend.chat.merge;

import com.branchat.backend.chat.domain.SubChatMessage;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Renders a sub-conversation as chronological {@code [timestamp] Role: content} lines. */
@Component
public class TranscriptRenderer {

  static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  public String render(List<SubChatMessage> messages) {
    if (messages == null || messages.isEmpty()) {
      return "";
    }
    return messages.stream()
        .map(
            message ->
                "["
                    + TIMESTAMP.format(message.getCreatedAt())
                    + "] "
                    + message.getRole().label()
                    + ": "
                    + message.getContent())
        .collect(Collectors.joining("\n\n"));
  }
}
