package com.github.fsm.serialization;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.fsm.StateMachineException;
import com.github.fsm.StateMachineException.Code;

/**
 * Codec backed by a Jackson {@link ObjectMapper}. Subclasses only pick the data format.
 */
abstract class JacksonStateMachineCodec implements StateMachineCodec {
  private static final Logger logger =
      LogManager.getLogger(JacksonStateMachineCodec.class.getSimpleName());

  private final ObjectMapper mapper;
  private final String format;

  JacksonStateMachineCodec(final ObjectMapper mapper, final String format) {
    this.mapper = mapper;
    this.format = format;
  }

  @Override
  public String encode(final SerializableStateMachine stateMachine) throws StateMachineException {
    if (stateMachine == null) {
      throw new StateMachineException(Code.SERIALIZATION_FAILURE,
          "Cannot encode a null state machine as " + format);
    }
    try {
      return mapper.writeValueAsString(stateMachine);
    } catch (JsonProcessingException problem) {
      throw new StateMachineException(Code.SERIALIZATION_FAILURE,
          "Failed to encode " + stateMachine.getEntityLabel() + " as " + format, problem);
    }
  }

  @Override
  public SerializableStateMachine decode(final String encoded) throws StateMachineException {
    if (encoded == null || encoded.trim().isEmpty()) {
      throw new StateMachineException(Code.SERIALIZATION_FAILURE,
          "Nothing to decode from empty " + format);
    }
    final SerializableStateMachine stateMachine;
    try {
      stateMachine = mapper.readValue(encoded, SerializableStateMachine.class);
    } catch (JsonProcessingException problem) {
      throw new StateMachineException(Code.SERIALIZATION_FAILURE,
          "Failed to decode state machine from " + format + ": " + problem.getOriginalMessage(),
          problem);
    }
    if (stateMachine == null) {
      throw new StateMachineException(Code.SERIALIZATION_FAILURE,
          "Decoded " + format + " holds no state machine");
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Decoded " + stateMachine + " from " + format);
    }
    return stateMachine;
  }

}
