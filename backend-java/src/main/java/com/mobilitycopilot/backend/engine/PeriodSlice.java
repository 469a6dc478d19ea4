package com.mobilitycopilot.backend.engine;

import java.util.List;

import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * Records of each source inside its own window. Each source is anchored on its own latest date.
 */
public record PeriodSlice(
    List<IncidentRecord> collisions,
    List<ServiceRequestRecord> requests,
    TimeWindow collisionsWindow,
    TimeWindow requestsWindow) {}
