package com.mobilitycopilot.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mobilitycopilot.backend.engine.CopilotResponse;
import com.mobilitycopilot.backend.engine.SessionContext;

public final class CopilotDtos {
  private CopilotDtos() {}

  public record AnswerIn(
      String question,
      String period,
      @JsonProperty("skip_ambiguity") Boolean skipAmbiguity,
      SessionContext session
  ) {}

  public record ChooseIn(
      @JsonProperty("option_index") Integer optionIndex,
      String period,
      SessionContext session
  ) {}

  public record AnswerOut(
      CopilotResponse response,
      SessionContext session
  ) {}
}
