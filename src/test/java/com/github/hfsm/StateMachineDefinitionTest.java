package com.github.hfsm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import com.github.hfsm.StateMachineDefinition.DefinitionBuilder;
import com.github.hfsm.StateMachineException.Code;
import com.github.hfsm.Transition.TransitionBuilder;

/**
 * Tests for building and validating definitions.
 */
public final class StateMachineDefinitionTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Guard yes = (instance, context) -> true;
  private static final Action noop = (instance, context) -> {
  };

  @Test
  public void testValidDefinition() throws StateMachineException {
    final StateMachineDefinition definition = DefinitionBuilder.newBuilder(" order ")
        .initialState("new").states("paid", "shipped").terminalStates("delivered", "cancelled")
        .events("pay", "ship", "deliver", "cancel")
        .guard("inStock", yes).guard("always", yes).action("reserve", noop)
        .action("notify", noop)
        .transition(TransitionBuilder.newBuilder().from("new").on("pay").to("paid")
            .guard("inStock").before("reserve").after("notify"))
        .transition(TransitionBuilder.newBuilder().from("new").on("pay").to("cancelled")
            .guard("always"))
        .transition(TransitionBuilder.newBuilder().from("paid").on("ship").to("shipped"))
        .transition(TransitionBuilder.newBuilder().from("shipped").on("deliver").to("delivered"))
        .transition(TransitionBuilder.newBuilder().from("new").on("cancel").to("cancelled"))
        .build();

    assertEquals("order", definition.getName());
    assertEquals("new", definition.getInitialState().getName());
    assertEquals(5, definition.getStates().size());
    assertEquals(2, definition.getTerminalStates().size());
    assertEquals(4, definition.getEvents().size());
    assertEquals(5, definition.getTransitions().size());
    assertTrue(definition.isTerminal(definition.findState("delivered")));
    assertFalse(definition.isTerminal(definition.findState("paid")));
    assertNull(definition.findState("returned"));
    assertNull(definition.findEvent("refund"));
    assertNotNull(definition.findEvent(" ship "));

    // candidates keep declaration order
    final List<Transition> candidates =
        definition.candidates(definition.findState("new"), definition.findEvent("pay"));
    assertEquals(2, candidates.size());
    assertEquals("new-[pay]->paid", candidates.get(0).getId());
    assertEquals("inStock", candidates.get(0).getGuardName());
    assertEquals("reserve", candidates.get(0).getBeforeActionNames().get(0));
    assertEquals("notify", candidates.get(0).getAfterActionNames().get(0));
    assertEquals("new-[pay]->cancelled", candidates.get(1).getId());

    // unknown pairs yield nothing, never null
    assertTrue(definition.candidates(definition.findState("delivered"),
        definition.findEvent("pay")).isEmpty());
    assertTrue(definition.candidates(definition.findState("paid"),
        definition.findEvent("deliver")).isEmpty());
  }

  @Test
  public void testTransitionsAreImmutable() throws StateMachineException {
    final StateMachineDefinition definition = DefinitionBuilder.newBuilder("door")
        .initialState("closed").state("open").events("push")
        .transition(TransitionBuilder.newBuilder().from("closed").on("push").to("open"))
        .build();
    try {
      definition.getTransitions().clear();
      fail("Expected transitions to be read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      definition.candidates(definition.findState("closed"), definition.findEvent("push")).clear();
      fail("Expected candidates to be read-only");
    } catch (UnsupportedOperationException expected) {
    }
  }

  @Test
  public void testNoInitialState() {
    assertInvalid(DefinitionBuilder.newBuilder("m").states("a", "b").events("go")
        .transition(TransitionBuilder.newBuilder().from("a").on("go").to("b")),
        "Exactly one initial state");
  }

  @Test
  public void testTwoInitialStates() {
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").initialState("b")
        .events("go"), "Exactly one initial state");
  }

  @Test
  public void testNoStates() {
    assertInvalid(DefinitionBuilder.newBuilder("m").events("go"), "At least one state");
  }

  @Test
  public void testBlankName() {
    assertInvalid(DefinitionBuilder.newBuilder("  ").initialState("a"), "name cannot be blank");
  }

  @Test
  public void testDuplicateStateAndEvent() {
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").states("b", "b"),
        "Duplicate state: b");
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").events("go", "go"),
        "Duplicate event: go");
  }

  @Test
  public void testEventCollidesWithState() {
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").state("b").events("b"),
        "collides with state name: b");
  }

  @Test
  public void testUndeclaredTransitionMembers() {
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").state("b").events("go")
        .transition(TransitionBuilder.newBuilder().from("x").on("go").to("b")),
        "undeclared fromState");
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").state("b").events("go")
        .transition(TransitionBuilder.newBuilder().from("a").on("go").to("y")),
        "undeclared toState");
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").state("b").events("go")
        .transition(TransitionBuilder.newBuilder().from("a").on("jump").to("b")),
        "undeclared event");
  }

  @Test
  public void testTransitionOutOfTerminalState() {
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").terminalState("done")
        .events("finish", "reopen")
        .transition(TransitionBuilder.newBuilder().from("a").on("finish").to("done"))
        .transition(TransitionBuilder.newBuilder().from("done").on("reopen").to("a")),
        "leaves terminal state");
  }

  @Test
  public void testUnknownGuardAndActions() {
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").state("b").events("go")
        .transition(TransitionBuilder.newBuilder().from("a").on("go").to("b").guard("missing")),
        "unknown guard missing");
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").state("b").events("go")
        .transition(TransitionBuilder.newBuilder().from("a").on("go").to("b").before("nope")),
        "unknown action nope");
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").state("b").events("go")
        .transition(TransitionBuilder.newBuilder().from("a").on("go").to("b").after("later")),
        "unknown action later");
  }

  @Test
  public void testDuplicateRegistrations() {
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").guard("g", yes)
        .guard("g", yes), "Duplicate guard: g");
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").action("x", noop)
        .action("x", noop), "Duplicate action: x");
    assertInvalid(DefinitionBuilder.newBuilder("m").initialState("a").guard("g", null),
        "Guard name and function cannot be null");
  }

  @Test
  public void testAllViolationsReportedTogether() {
    final StateMachineException problem = assertInvalid(DefinitionBuilder.newBuilder("m")
        .states("a", "a").events("go")
        .transition(TransitionBuilder.newBuilder().from("a").on("go").to("z")),
        "Duplicate state: a");
    assertTrue(problem.getMessage().contains("Exactly one initial state"));
    assertTrue(problem.getMessage().contains("undeclared toState"));
  }

  @Test
  public void testStateAndEventNames() throws StateMachineException {
    assertEquals("open", new State(" open ").getName());
    assertEquals(new State("open"), new State("open"));
    assertEquals(new Event("push"), new Event(" push"));
    try {
      new State(" ");
      fail("Expected blank state name to be rejected");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_STATE_NAME, problem.getCode());
    }
    final StringBuilder tooLong = new StringBuilder();
    for (int iter = 0; iter <= State.maxStateNameLength; iter++) {
      tooLong.append('x');
    }
    try {
      new Event(tooLong.toString());
      fail("Expected overlong event name to be rejected");
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_EVENT_NAME, problem.getCode());
    }
  }

  private static StateMachineException assertInvalid(final DefinitionBuilder builder,
      final String expectedMessage) {
    try {
      builder.build();
      fail("Expected definition to be rejected with " + expectedMessage);
      return null;
    } catch (StateMachineException problem) {
      assertEquals(Code.INVALID_DEFINITION, problem.getCode());
      assertTrue(problem.getMessage(), problem.getMessage().contains(expectedMessage));
      return problem;
    }
  }

}
