package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation state owned by the caller. The engine receives it with every question and
 * returns the next version; it keeps nothing between calls.
 */
public record SessionContext(
    String selectedPeriod,
    TimeWindow lastValidCustomRange,
    PendingChoice pendingChoice,
    List<ChatTurn> history) {

  public SessionContext {
    history = history == null ? List.of() : List.copyOf(history);
  }

  public static SessionContext empty() {
    return new SessionContext(PeriodResolver.LAST_30_DAYS, null, null, List.of());
  }

  public SessionContext withPeriod(String period, TimeWindow lastValid) {
    return new SessionContext(period, lastValid, pendingChoice, history);
  }

  public SessionContext withPending(PendingChoice pending) {
    return new SessionContext(selectedPeriod, lastValidCustomRange, pending, history);
  }

  public SessionContext withoutPending() {
    return withPending(null);
  }

  /** Appends a turn, dropping the oldest ones beyond {@code limit}. */
  public SessionContext withTurn(ChatTurn turn, int limit) {
    List<ChatTurn> h = new ArrayList<>(history);
    h.add(turn);
    int max = Math.max(1, limit);
    if (h.size() > max) {
      h = h.subList(h.size() - max, h.size());
    }
    return new SessionContext(selectedPeriod, lastValidCustomRange, pendingChoice, h);
  }
}
