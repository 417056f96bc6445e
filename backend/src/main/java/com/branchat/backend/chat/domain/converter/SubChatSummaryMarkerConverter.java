package com.branchat.backend.chat.domain.converter;

import com.branchat.backend.chat.domain.SubChatSummaryMarker;
import com.branchat.backend.shared.json.AbstractJacksonJsonAttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = false)
public class SubChatSummaryMarkerConverter
    extends AbstractJacksonJsonAttributeConverter<SubChatSummaryMarker> {

  public SubChatSummaryMarkerConverter() {
    super(SubChatSummaryMarker.class);
  }
}
