package com.mobilitycopilot.backend.engine;

import java.time.LocalDate;

/**
 * Effective period of one question. {@code customRange} is set only for custom ranges.
 */
public record ResolvedPeriod(String label, int days, TimeWindow customRange) {

  public boolean isCustom() {
    return customRange != null;
  }

  public boolean isWidest() {
    return !isCustom() && days >= PeriodResolver.WIDEST_DAYS;
  }

  /** Window for a source whose latest record is {@code anchor}. */
  public TimeWindow windowFor(LocalDate anchor) {
    if (customRange != null) {
      return customRange;
    }
    return TimeWindow.endingAt(anchor, days);
  }
}
