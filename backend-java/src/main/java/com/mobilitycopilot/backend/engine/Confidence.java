package com.mobilitycopilot.backend.engine;

public record Confidence(ConfidenceLevel level, String label, String detail) {}
