package com.branchat.backend.shared.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Base converter for values stored in {@code jsonb} columns. Subclasses describe the target type and
 * decide which value represents an absent column.
 */
public abstract class AbstractJacksonJsonAttributeConverter<T> implements AttributeConverter<T, JsonNode> {

  protected static final JsonMapper MAPPER =
      JsonMapper.builder()
          .findAndAddModules()
          .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
          .build();

  private final JavaType type;

  protected AbstractJacksonJsonAttributeConverter(Class<T> type) {
    this(MAPPER.constructType(type));
  }

  protected AbstractJacksonJsonAttributeConverter(JavaType type) {
    this.type = type;
  }

  /** Value returned for SQL {@code NULL} or JSON {@code null}. */
  protected T emptyValue() {
    return null;
  }

  protected boolean isEmpty(T attribute) {
    return attribute == null;
  }

  @Override
  public JsonNode convertToDatabaseColumn(T attribute) {
    if (isEmpty(attribute)) {
      return null;
    }
    return MAPPER.valueToTree(attribute);
  }

  @Override
  public T convertToEntityAttribute(JsonNode dbData) {
    if (dbData == null || dbData.isNull() || dbData.isMissingNode()) {
      return emptyValue();
    }
    try {
      T value = MAPPER.treeToValue(dbData, type);
      return value != null ? value : emptyValue();
    } catch (JsonProcessingException exception) {
      throw new IllegalStateException(
          "Failed to convert JSON to " + type.getRawClass().getSimpleName(), exception);
    }
  }
}
