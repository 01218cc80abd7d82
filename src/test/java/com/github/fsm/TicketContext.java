package com.github.fsm;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable context that ticket machines are evaluated against.
 */
public final class TicketContext {
  boolean agentAssigned;
  boolean customerConfirmed;
  boolean flag;
  final List<String> audit = new ArrayList<>();

  void note(final TicketState from, final TicketState to) {
    audit.add(from + "->" + to);
  }
}
