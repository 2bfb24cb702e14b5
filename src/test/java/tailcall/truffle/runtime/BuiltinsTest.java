package tailcall.truffle.runtime;

import static org.junit.jupiter.api.Assertions.*;

import tailcall.truffle.runtime.Builtins.BuiltinException;
import org.junit.jupiter.api.Test;

class BuiltinsTest {

  private static Object call(String op, Object... args) {
    return Builtins.call(op, args);
  }

  @Test
  void arithmetic() {
    assertEquals(6L, call("+", 1L, 2L, 3L));
    assertEquals(0L, call("+"));
    assertEquals(-4L, call("-", 4L));
    assertEquals(3.5, call("+", 1L, 2.5));
    assertEquals(24L, call("*", 2L, 3L, 4L));
    assertEquals(2L, call("mod", -1L, 3L), "mod 取下整");
    assertEquals(11L, call("inc", 10L));
    assertEquals(9L, call("dec", 10L));
  }

  @Test
  void divisionIsExactWhenPossible() {
    assertEquals(3L, call("/", 6L, 2L));
    assertEquals(0.5, call("/", 1L, 2L));
    assertEquals(0.25, call("/", 4L));
  }

  @Test
  void divisionByZero() {
    BuiltinException e = assertThrows(BuiltinException.class, () -> call("/", 1L, 0L));
    assertTrue(e.getMessage().contains("division by zero"));
    assertThrows(BuiltinException.class, () -> call("/", 1.0, 0.0));
    assertThrows(BuiltinException.class, () -> call("mod", 1L, 0L));
  }

  @Test
  void overflowIsAnError() {
    BuiltinException e = assertThrows(BuiltinException.class, () -> call("+", Long.MAX_VALUE, 1L));
    assertTrue(e.getMessage().contains("integer overflow"));
    assertThrows(BuiltinException.class, () -> call("*", Long.MAX_VALUE, 2L));
  }

  @Test
  void comparisonsChainAndCompareNumerically() {
    assertEquals(true, call("<", 1L, 2L, 3L));
    assertEquals(false, call("<", 1L, 3L, 2L));
    assertEquals(true, call("=", 1L, 1.0));
    assertEquals(true, call(">=", 3L, 3L, 1L));
    assertEquals(false, call("=", true, 1L));
  }

  @Test
  void predicatesAndTruthiness() {
    assertEquals(true, call("zero?", 0L));
    assertEquals(true, call("even?", 4L));
    assertEquals(true, call("odd?", 3L));
    assertEquals(false, call("not", 0L), "只有 false 为假");
    assertEquals(true, call("not", false));
    assertTrue(Builtins.isTruthy(0L));
    assertFalse(Builtins.isTruthy(false));
  }

  @Test
  void hostNumbersAreNormalized() {
    assertEquals(5L, Builtins.normalize(5));
    assertEquals(1.5, Builtins.normalize(1.5f));
    assertEquals(7L, call("+", 3, (short) 4));
  }

  @Test
  void typeErrors() {
    BuiltinException e = assertThrows(BuiltinException.class, () -> call("+", 1L, true));
    assertTrue(e.getMessage().contains("expected Number"));
    assertThrows(BuiltinException.class, () -> call("zero?"));
    assertThrows(BuiltinException.class, () -> call("launch"));
  }
}
