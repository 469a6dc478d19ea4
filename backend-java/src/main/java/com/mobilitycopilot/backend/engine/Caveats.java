package com.mobilitycopilot.backend.engine;

/** Limits of a reading, the check to run next, and a decision it could support. */
public record Caveats(String limits, String verification, String decision) {}
