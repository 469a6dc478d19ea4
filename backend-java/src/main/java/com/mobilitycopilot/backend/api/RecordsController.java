package com.mobilitycopilot.backend.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.mobilitycopilot.backend.dto.RecordDtos.RecordsSummaryOut;
import com.mobilitycopilot.backend.service.RecordStoreService;

@RestController
public class RecordsController {
  private final RecordStoreService recordStoreService;

  public RecordsController(RecordStoreService recordStoreService) {
    this.recordStoreService = recordStoreService;
  }

  @GetMapping("/v1/records/summary")
  public RecordsSummaryOut summary() {
    return recordStoreService.summary();
  }
}
