package com.github.fsm.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public final class YamlStateMachineCodec extends JacksonStateMachineCodec {

  public YamlStateMachineCodec() {
    super(new ObjectMapper(new YAMLFactory()), "YAML");
  }

}
