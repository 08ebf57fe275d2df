package com.cricket.live.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.math.BigDecimal;

final class JsonFields {
  private JsonFields() {}

  static boolean isAbsent(JsonNode value) {
    return value == null || value.isMissingNode() || value.isNull();
  }

  static JsonNode firstPresent(JsonNode node, String... fieldNames) {
    if (node == null) {
      return MissingNode.getInstance();
    }
    for (String fieldName : fieldNames) {
      JsonNode value = node.path(fieldName);
      if (!isAbsent(value)) {
        return value;
      }
    }
    return MissingNode.getInstance();
  }

  // Empty strings, zero and false count as "not set" in the scoring feeds.
  static boolean isSet(JsonNode value) {
    if (isAbsent(value)) {
      return false;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isNumber()) {
      double number = value.doubleValue();
      return number != 0 && !Double.isNaN(number);
    }
    if (value.isTextual()) {
      return !value.textValue().isEmpty();
    }
    return true;
  }

  static String firstSetText(JsonNode node, String... fieldNames) {
    if (node == null) {
      return null;
    }
    for (String fieldName : fieldNames) {
      JsonNode value = node.path(fieldName);
      if (isSet(value)) {
        return text(value);
      }
    }
    return null;
  }

  static String text(JsonNode value) {
    if (isAbsent(value) || value.isContainerNode()) {
      return null;
    }
    return value.asText();
  }

  static Integer toInteger(JsonNode value, String label) {
    if (isAbsent(value)) {
      return null;
    }
    if (value.isNumber()) {
      return wholeNumber(value.decimalValue(), label, value.asText());
    }
    if (value.isTextual()) {
      String raw = value.textValue().trim();
      if (raw.isEmpty()) {
        return null;
      }
      try {
        return wholeNumber(new BigDecimal(raw), label, raw);
      } catch (NumberFormatException ex) {
        throw new EnrichmentException(label + " is not a whole number: " + raw);
      }
    }
    throw new EnrichmentException(label + " has unexpected type " + value.getNodeType());
  }

  private static Integer wholeNumber(BigDecimal number, String label, String raw) {
    try {
      return number.intValueExact();
    } catch (ArithmeticException ex) {
      throw new EnrichmentException(label + " is not a whole number: " + raw);
    }
  }

  static Double toDouble(JsonNode value, String label) {
    if (isAbsent(value)) {
      return null;
    }
    if (value.isNumber()) {
      return value.doubleValue();
    }
    if (value.isTextual()) {
      String raw = value.textValue().trim();
      if (raw.isEmpty()) {
        return null;
      }
      try {
        return Double.valueOf(raw);
      } catch (NumberFormatException ex) {
        throw new EnrichmentException(label + " is not a number: " + raw);
      }
    }
    throw new EnrichmentException(label + " has unexpected type " + value.getNodeType());
  }

  static Boolean toBoolean(JsonNode value, String label) {
    if (isAbsent(value)) {
      return null;
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    if (value.isTextual() && ("true".equalsIgnoreCase(value.textValue())
        || "false".equalsIgnoreCase(value.textValue()))) {
      return Boolean.valueOf(value.textValue());
    }
    throw new EnrichmentException(label + " is not a boolean: " + value);
  }
}
