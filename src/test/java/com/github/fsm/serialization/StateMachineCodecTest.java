package com.github.fsm.serialization;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import com.github.fsm.StateMachineException;
import com.github.fsm.StateMachineException.Code;

/**
 * Tests for the JSON and YAML encodings of serializable state machines.
 */
public class StateMachineCodecTest {

  private static SerializableStateMachine orderMachine() {
    return new SerializableStateMachine("Order", "PLACED",
        Arrays.asList("PLACED", "PAID", "SHIPPED", "CANCELLED"),
        Arrays.asList(new SerializableTransition("PLACED", "PAID", "PaymentCaptured", "EmitPaid"),
            new SerializableTransition("PAID", "SHIPPED", null, "NotifyCustomer"),
            new SerializableTransition("PLACED", "CANCELLED", "CustomerRequested", null),
            new SerializableTransition("PAID", "CANCELLED", null, null)));
  }

  @Test
  public void testJsonRoundTrip() throws StateMachineException {
    final StateMachineCodec codec = new JsonStateMachineCodec();
    final SerializableStateMachine original = orderMachine();
    assertEquals(original, codec.decode(codec.encode(original)));
  }

  @Test
  public void testYamlRoundTrip() throws StateMachineException {
    final StateMachineCodec codec = new YamlStateMachineCodec();
    final SerializableStateMachine original = orderMachine();
    assertEquals(original, codec.decode(codec.encode(original)));
  }

  @Test
  public void testEncodingsAreInterchangeable() throws StateMachineException {
    final StateMachineCodec json = new JsonStateMachineCodec(true);
    final StateMachineCodec yaml = new YamlStateMachineCodec();
    final SerializableStateMachine fromJson = json.decode(json.encode(orderMachine()));
    assertEquals(orderMachine(), yaml.decode(yaml.encode(fromJson)));
  }

  @Test
  public void testAbsentNamesAreOmitted() throws StateMachineException {
    final SerializableStateMachine machine = new SerializableStateMachine("Order", "PLACED",
        Arrays.asList("PLACED", "PAID"),
        Arrays.asList(new SerializableTransition("PLACED", "PAID", null, null)));
    final String json = new JsonStateMachineCodec().encode(machine);
    assertTrue(json.contains("\"initialState\":\"PLACED\""));
    assertFalse(json.contains("conditionName"));
    assertFalse(json.contains("sideEffectName"));
  }

  @Test
  public void testDecodeHandWrittenYaml() throws StateMachineException {
    final String yaml = "entityLabel: Order\n"
        + "initialState: PLACED\n"
        + "states: [PLACED, PAID]\n"
        + "transitions:\n"
        + "  - from: PLACED\n"
        + "    to: PAID\n"
        + "    conditionName: PaymentCaptured\n";
    final SerializableStateMachine machine = new YamlStateMachineCodec().decode(yaml);
    assertEquals("Order", machine.getEntityLabel());
    assertEquals(Arrays.asList("PLACED", "PAID"), machine.getStates());
    assertEquals("PaymentCaptured", machine.getTransitions().get(0).getConditionName());
    assertNull(machine.getTransitions().get(0).getSideEffectName());
  }

  @Test
  public void testMalformedInputFails() {
    assertDecodeFails(new JsonStateMachineCodec(), "{\"entityLabel\": ");
    assertDecodeFails(new JsonStateMachineCodec(), "{\"entityLabel\":\"Order\",\"bogus\":1}");
    assertDecodeFails(new JsonStateMachineCodec(), "   ");
    assertDecodeFails(new YamlStateMachineCodec(), "states: [PLACED\n");
    assertDecodeFails(new YamlStateMachineCodec(), null);
  }

  @Test
  public void testEncodeNullFails() {
    try {
      new JsonStateMachineCodec().encode(null);
      fail("encoding null should fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.SERIALIZATION_FAILURE, expected.getCode());
    }
  }

  private static void assertDecodeFails(final StateMachineCodec codec, final String encoded) {
    try {
      codec.decode(encoded);
      fail("decoding '" + encoded + "' should fail");
    } catch (StateMachineException expected) {
      assertEquals(Code.SERIALIZATION_FAILURE, expected.getCode());
    }
  }

}
