package com.codeheadsystems.pqsession.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Base64 and timestamp helpers shared by the wire records.
 */
public final class WireFields {

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private WireFields() {
  }

  public static String encode(byte[] value) {
    return value == null ? null : B64.encodeToString(value);
  }

  /**
   * Decodes a required base64 field.
   *
   * @param value     the encoded value
   * @param fieldName the JSON field name, used in the error message
   * @return the decoded bytes
   * @throws IllegalArgumentException if the value is missing or not base64
   */
  public static byte[] decode(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    try {
      return B64D.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + fieldName, e);
    }
  }

  /**
   * Decodes an optional base64 field; absent values decode to {@code null}.
   */
  public static byte[] decodeOptional(String value, String fieldName) {
    return (value == null || value.isBlank()) ? null : decode(value, fieldName);
  }

  public static String required(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    return value;
  }

  public static String formatInstant(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  public static Instant parseInstant(String value, String fieldName) {
    try {
      return Instant.parse(required(value, fieldName));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid timestamp in field: " + fieldName, e);
    }
  }
}
