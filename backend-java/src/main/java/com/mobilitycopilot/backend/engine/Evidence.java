package com.mobilitycopilot.backend.engine;

import java.util.List;

/**
 * Tagged proof lines: {@code [AGR-n]} aggregates and {@code [LIG-n]} source rows.
 */
public record Evidence(List<String> aggregates, List<String> sourceRows) {

  public Evidence {
    aggregates = List.copyOf(aggregates);
    sourceRows = List.copyOf(sourceRows);
  }
}
