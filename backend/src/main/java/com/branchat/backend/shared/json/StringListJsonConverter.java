package com.branchat.backend.shared.json;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Converter;
import java.util.List;

@Converter
public class StringListJsonConverter extends AbstractJacksonJsonAttributeConverter<List<String>> {

  public StringListJsonConverter() {
    super(MAPPER.getTypeFactory().constructCollectionType(List.class, String.class));
  }

  @Override
  protected List<String> emptyValue() {
    return List.of();
  }

  @Override
  protected boolean isEmpty(List<String> attribute) {
    return attribute == null || attribute.isEmpty();
  }

  @Override
  public List<String> convertToEntityAttribute(JsonNode dbData) {
    return List.copyOf(super.convertToEntityAttribute(dbData));
  }
}
