package com.mobilitycopilot.backend.config;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * Accepts the date shapes the UI sends back in a session.
 *
 * Examples accepted:
 * - 2024-03-01
 * - 2024/03/01
 * - 2024-03-01T00:00:00
 * - 2024-03-01T00:00:00Z
 */
public final class LenientLocalDateDeserializer extends JsonDeserializer<LocalDate> {
  private static final DateTimeFormatter SLASHED = DateTimeFormatter.ofPattern("yyyy/MM/dd");

  @Override
  public LocalDate deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    String raw = p.getValueAsString();
    if (raw == null) {
      return null;
    }
    String s = raw.trim();
    if (s.isEmpty()) {
      return null;
    }

    try {
      return LocalDate.parse(s);
    } catch (DateTimeParseException ignored) {
      // fall through
    }
    try {
      return LocalDate.parse(s, SLASHED);
    } catch (DateTimeParseException ignored) {
      // fall through
    }
    try {
      return LocalDateTime.parse(s).toLocalDate();
    } catch (DateTimeParseException ignored) {
      // fall through
    }
    try {
      return OffsetDateTime.parse(s).toLocalDate();
    } catch (DateTimeParseException ignored) {
      // fall through
    }
    try {
      return Instant.parse(s).atOffset(ZoneOffset.UTC).toLocalDate();
    } catch (DateTimeParseException ignored) {
      // fall through
    }

    return (LocalDate) ctxt.handleWeirdStringValue(
        LocalDate.class,
        s,
        "Invalid date format; expected YYYY-MM-DD"
    );
  }
}
