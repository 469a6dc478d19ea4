package com.mobilitycopilot.backend.service;

import org.springframework.stereotype.Service;

import com.mobilitycopilot.backend.dto.CopilotDtos.AnswerIn;
import com.mobilitycopilot.backend.dto.CopilotDtos.AnswerOut;
import com.mobilitycopilot.backend.dto.CopilotDtos.ChooseIn;
import com.mobilitycopilot.backend.engine.QueryEngine;
import com.mobilitycopilot.backend.engine.QueryEngine.Answer;

@Service
public class CopilotService {
  private final QueryEngine queryEngine;
  private final RecordStoreService recordStoreService;

  public CopilotService(QueryEngine queryEngine, RecordStoreService recordStoreService) {
    this.queryEngine = queryEngine;
    this.recordStoreService = recordStoreService;
  }

  public AnswerOut answer(AnswerIn payload) {
    String q = payload == null || payload.question() == null ? "" : payload.question().trim();
    boolean skip = payload != null && Boolean.TRUE.equals(payload.skipAmbiguity());
    Answer a = queryEngine.answer(
        recordStoreService.store(),
        q,
        payload == null ? null : payload.period(),
        skip,
        payload == null ? null : payload.session());
    return new AnswerOut(a.response(), a.session());
  }

  /**
   * @throws IllegalArgumentException when the option index is missing or nothing is pending
   */
  public AnswerOut choose(ChooseIn payload) {
    if (payload == null || payload.optionIndex() == null) {
      throw new IllegalArgumentException("option_index is required");
    }
    Answer a = queryEngine.choose(
        recordStoreService.store(),
        payload.optionIndex(),
        payload.period(),
        payload.session());
    return new AnswerOut(a.response(), a.session());
  }
}
