package com.github.fsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.fsm.StateMachineException.Code;

public class StateMachineDefinitionTest {
  private static final State<TicketState> OPEN = State.of(TicketState.OPEN);
  private static final State<TicketState> IN_PROGRESS = State.of(TicketState.IN_PROGRESS);
  private static final State<TicketState> RESOLVED = State.of(TicketState.RESOLVED);

  @Test
  public void testDirectConstruction() throws StateMachineException {
    final List<Transition<TicketState, TicketContext>> transitions =
        Arrays.asList(new Transition<>(OPEN, IN_PROGRESS), new Transition<>(IN_PROGRESS, RESOLVED),
            new Transition<>(OPEN, RESOLVED));
    final StateMachineDefinition<TicketState, TicketContext> definition =
        new StateMachineDefinition<>("Ticket", Arrays.asList(OPEN, IN_PROGRESS, RESOLVED),
            transitions, OPEN);

    assertEquals("Ticket", definition.getEntityLabel());
    assertEquals(OPEN, definition.getInitialState());
    assertEquals(3, definition.getStates().size());
    assertEquals(transitions, definition.getTransitions());
    assertEquals(TicketState.class, definition.getStateType());
    assertEquals(2, definition.getTransitionsFrom(OPEN).size());
    assertEquals(IN_PROGRESS, definition.getTransitionsFrom(OPEN).get(0).getToState());
    assertEquals(RESOLVED, definition.findState("RESOLVED").get());
    assertFalse(definition.findState("CLOSED").isPresent());
  }

  @Test
  public void testUndeclaredInitialStateRejected() throws StateMachineException {
    try {
      new StateMachineDefinition<TicketState, TicketContext>("Ticket",
          Collections.singletonList(IN_PROGRESS), Collections.emptyList(), OPEN);
      fail("initial state must be declared");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_DEFINITION, expected.getCode());
    }
  }

  @Test
  public void testUndeclaredTransitionEndpointRejected() throws StateMachineException {
    final List<Transition<TicketState, TicketContext>> transitions =
        Collections.singletonList(new Transition<>(OPEN, RESOLVED));
    try {
      new StateMachineDefinition<>("Ticket", Arrays.asList(OPEN, IN_PROGRESS), transitions, OPEN);
      fail("transition endpoints must be declared");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_DEFINITION, expected.getCode());
    }
  }

  @Test
  public void testNullEndpointRejected() {
    try {
      new Transition<TicketState, TicketContext>(OPEN, null);
      fail("null endpoint must be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_DEFINITION, expected.getCode());
    }
  }

  @Test
  public void testNullStateRejected() {
    try {
      new StateMachineDefinition<TicketState, TicketContext>("Ticket", Arrays.asList(OPEN, null),
          Collections.<Transition<TicketState, TicketContext>>emptyList(), OPEN);
      fail("null state must be rejected");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_DEFINITION, expected.getCode());
    }
  }

  @Test
  public void testDefinitionIsImmutable() throws StateMachineException {
    final StateMachineDefinition<TicketState, TicketContext> definition =
        new StateMachineDefinition<>("Ticket", Arrays.asList(OPEN, IN_PROGRESS),
            Collections.singletonList(new Transition<>(OPEN, IN_PROGRESS)), OPEN);
    try {
      definition.getStates().add(RESOLVED);
      fail("states must be read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      definition.getTransitions().clear();
      fail("transitions must be read-only");
    } catch (UnsupportedOperationException expected) {
    }
    assertEquals(2, definition.getStates().size());
    assertEquals(1, definition.getTransitions().size());
  }

  @Test
  public void testStateEqualityByName() {
    assertEquals(State.of(TicketState.OPEN), OPEN);
    assertEquals(State.of(TicketState.OPEN).hashCode(), OPEN.hashCode());
    assertFalse(OPEN.equals(IN_PROGRESS));
    assertEquals("IN_PROGRESS", IN_PROGRESS.getName());
  }

  @Test
  public void testUnguardedTransitionDefaults() throws StateMachineException {
    final Transition<TicketState, TicketContext> transition = new Transition<>(OPEN, RESOLVED);
    assertTrue(transition.getCondition().test(new TicketContext()));
    assertFalse(transition.getSideEffect().isPresent());
    assertFalse(transition.getConditionName().isPresent());
    assertFalse(transition.getSideEffectName().isPresent());
  }

}
