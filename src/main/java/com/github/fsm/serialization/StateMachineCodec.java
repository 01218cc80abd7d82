package com.github.fsm.serialization;

import com.github.fsm.StateMachineException;

/**
 * Textual encoding of a {@link SerializableStateMachine}. Implementations are interchangeable:
 * decoding what one of them encoded yields a state machine equal to the original, field for
 * field.
 */
public interface StateMachineCodec {

  String encode(final SerializableStateMachine stateMachine) throws StateMachineException;

  SerializableStateMachine decode(final String encoded) throws StateMachineException;

}
