package com.mobilitycopilot.backend.util;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the sidebar's custom range label, e.g.
 * {@code "Personnalisée : 2024-01-01 -> 2024-03-31"}.
 */
public final class CustomPeriodParser {
  private CustomPeriodParser() {}

  public static final String PREFIX = "Personnalisée";

  public record ParsedRange(LocalDate start, LocalDate end) {}

  private static final Pattern CUSTOM = Pattern.compile(
      "personnalis[ée]e\\s*:\\s*(\\d{4}-\\d{2}-\\d{2})\\s*(?:->|→)\\s*(\\d{4}-\\d{2}-\\d{2})",
      Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private static final Pattern CUSTOM_HINT = Pattern.compile("^\\s*personnalis", Pattern.CASE_INSENSITIVE);

  /**
   * True when the label is meant as a custom range, whether or not it parses.
   */
  public static boolean looksCustom(String label) {
    return label != null && CUSTOM_HINT.matcher(TextNormalizer.fold(label)).find();
  }

  public static Optional<ParsedRange> parse(String label) {
    if (label == null || label.isBlank()) {
      return Optional.empty();
    }
    Matcher m = CUSTOM.matcher(label.trim());
    if (!m.find()) {
      return Optional.empty();
    }
    try {
      LocalDate start = LocalDate.parse(m.group(1));
      LocalDate end = LocalDate.parse(m.group(2));
      if (start.isAfter(end)) {
        LocalDate tmp = start;
        start = end;
        end = tmp;
      }
      return Optional.of(new ParsedRange(start, end));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  public static String format(LocalDate start, LocalDate end) {
    return PREFIX + " : " + start + " -> " + end;
  }
}
