package com.emcit.infrastructure.asset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;
import java.util.TreeMap;

/**
 * Stores the technical specs map as a JSON object in a text column.
 */
@Converter
public class TechnicalSpecsConverter implements AttributeConverter<Map<String, String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<TreeMap<String, String>> TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Map<String, String> attribute) {
    if (attribute == null || attribute.isEmpty()) return "{}";
    try {
      return MAPPER.writeValueAsString(new TreeMap<>(attribute));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Technical specs are not serializable", e);
    }
  }

  @Override
  public Map<String, String> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) return new TreeMap<>();
    try {
      return MAPPER.readValue(dbData, TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt technical_specs column", e);
    }
  }
}
