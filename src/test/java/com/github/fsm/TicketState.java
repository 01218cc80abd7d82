package com.github.fsm;

/**
 * Support ticket lifecycle used across tests.
 */
public enum TicketState {
  OPEN, IN_PROGRESS, RESOLVED, CLOSED;
}
