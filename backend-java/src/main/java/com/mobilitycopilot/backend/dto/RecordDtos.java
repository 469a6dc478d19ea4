package com.mobilitycopilot.backend.dto;

import java.util.List;

public final class RecordDtos {
  private RecordDtos() {}

  public record SourceSummary(
      int rows,
      String minDate,
      String maxDate,
      int skipped
  ) {}

  public record RecordsSummaryOut(
      SourceSummary collisions,
      SourceSummary serviceRequests,
      SourceSummary transitStops,
      SourceSummary weather,
      String earliestDate,
      String latestDate,
      List<String> periods
  ) {}
}
