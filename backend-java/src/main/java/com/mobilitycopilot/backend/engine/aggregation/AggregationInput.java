package com.mobilitycopilot.backend.engine.aggregation;

import java.util.List;

import com.mobilitycopilot.backend.engine.AnalysisRequest;
import com.mobilitycopilot.backend.engine.PeriodSlice;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.RecordStore;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * Arguments of one aggregation run: the unfiltered store, the period slice and the request.
 */
public record AggregationInput(RecordStore store, PeriodSlice slice, AnalysisRequest request) {

  public List<IncidentRecord> collisions() {
    return slice.collisions();
  }

  public List<ServiceRequestRecord> requests() {
    return slice.requests();
  }
}
