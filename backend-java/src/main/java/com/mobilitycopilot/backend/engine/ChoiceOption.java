package com.mobilitycopilot.backend.engine;

public record ChoiceOption(String label, String refinedQuestion) {}
