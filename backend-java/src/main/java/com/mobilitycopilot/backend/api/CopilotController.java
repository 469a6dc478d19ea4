package com.mobilitycopilot.backend.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.mobilitycopilot.backend.dto.CopilotDtos.AnswerIn;
import com.mobilitycopilot.backend.dto.CopilotDtos.AnswerOut;
import com.mobilitycopilot.backend.dto.CopilotDtos.ChooseIn;
import com.mobilitycopilot.backend.service.CopilotService;
import com.mobilitycopilot.backend.service.LlmChatClient;
import com.mobilitycopilot.backend.service.LlmChatClient.LlmStatus;

@RestController
public class CopilotController {
  private final CopilotService copilotService;
  private final LlmChatClient llmChatClient;

  public CopilotController(CopilotService copilotService, LlmChatClient llmChatClient) {
    this.copilotService = copilotService;
    this.llmChatClient = llmChatClient;
  }

  @PostMapping("/v1/copilot/answer")
  public AnswerOut answer(@RequestBody AnswerIn payload) {
    return copilotService.answer(payload);
  }

  @PostMapping("/v1/copilot/choose")
  public AnswerOut choose(@RequestBody ChooseIn payload) {
    return copilotService.choose(payload);
  }

  @GetMapping("/v1/copilot/status")
  public LlmStatus status() {
    return llmChatClient.status();
  }
}
