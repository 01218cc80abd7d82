package com.github.fsm.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class JsonStateMachineCodec extends JacksonStateMachineCodec {

  public JsonStateMachineCodec() {
    this(false);
  }

  public JsonStateMachineCodec(final boolean prettyPrint) {
    super(new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, prettyPrint), "JSON");
  }

}
