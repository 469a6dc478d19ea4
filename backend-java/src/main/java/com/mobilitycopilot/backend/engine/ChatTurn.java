package com.mobilitycopilot.backend.engine;

public record ChatTurn(String question, ResponseType type, AnalysisKind kind, ConfidenceLevel confidence) {}
