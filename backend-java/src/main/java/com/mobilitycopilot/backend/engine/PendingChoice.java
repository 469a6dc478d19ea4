package com.mobilitycopilot.backend.engine;

/** Options shown for {@code question}, waiting for the user's pick. */
public record PendingChoice(String question, Ambiguity choices) {}
