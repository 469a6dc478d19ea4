package com.mobilitycopilot.backend.engine;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive date range {@code [start, end]}.
 */
public record TimeWindow(LocalDate start, LocalDate end) {

  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("window start " + start + " is after end " + end);
    }
  }

  /** Same as the constructor but swaps reversed bounds. */
  public static TimeWindow of(LocalDate a, LocalDate b) {
    return a.isAfter(b) ? new TimeWindow(b, a) : new TimeWindow(a, b);
  }

  /** The {@code days} calendar days ending at {@code anchor}, anchor included. */
  public static TimeWindow endingAt(LocalDate anchor, int days) {
    int n = Math.max(1, days);
    return new TimeWindow(anchor.minusDays(n - 1L), anchor);
  }

  public long lengthDays() {
    return ChronoUnit.DAYS.between(start, end) + 1;
  }

  public boolean contains(LocalDate date) {
    return date != null && !date.isBefore(start) && !date.isAfter(end);
  }

  /** The window of equal length immediately before this one. */
  public TimeWindow previous() {
    long n = lengthDays();
    return new TimeWindow(start.minusDays(n), start.minusDays(1));
  }

  public String label() {
    return start + " -> " + end;
  }
}
