package com.mobilitycopilot.backend.engine.aggregation;

import com.mobilitycopilot.backend.engine.AggregationResult;

/**
 * One deterministic aggregation. Implementations must not modify their input.
 */
public interface Aggregation {

  AggregationResult aggregate(AggregationInput input);
}
