package tailcall.truffle.passes;

import static org.junit.jupiter.api.Assertions.*;
import static tailcall.truffle.ast.Trees.*;

import tailcall.truffle.InvariantViolationException;
import tailcall.truffle.MalformedExpressionException;
import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.ConvertedConditional;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.NewFlag;
import tailcall.truffle.ast.TrivialConditional;
import java.util.List;
import org.junit.jupiter.api.Test;

class ThunkifierTest {

  @Test
  void abstractionBodyIsSuspended() {
    Expr fn = fn(List.of("x", "k"), call("apply-k", var("x"), var("k")));
    assertEquals(fn(List.of("x", "k"), Abstraction.thunk(call("apply-k", var("x"), var("k")))),
        Thunkifier.thunkify(fn));
  }

  @Test
  void definitionBodyIsSuspended() {
    Definition def = new Definition("f", List.of("k"), call("apply-k", num(1), var("k")), "f$1");
    Definition out = (Definition) Thunkifier.thunkify(def);
    Abstraction body = assertInstanceOf(Abstraction.class, out.body());
    assertTrue(body.isThunk());
    assertEquals("f$1", out.selfName());
  }

  @Test
  void continuationSlotIsNotSuspended() {
    Expr k = fn(List.of("s"), call("apply-k", var("s"), var("k")));
    Expr app = call("f", num(1), k);
    assertEquals(app, Thunkifier.thunkify(app), "续延实参本身不应再包一层挂起");
  }

  @Test
  void functionArgumentsOutsideTheContinuationSlotAreThunkified() {
    Expr arg = fn(List.of("y", "k2"), call("apply-k", var("y"), var("k2")));
    Expr out = Thunkifier.thunkify(call("map", arg, var("k")));
    Expr expected = call("map",
        fn(List.of("y", "k2"), Abstraction.thunk(call("apply-k", var("y"), var("k2")))), var("k"));
    assertEquals(expected, out);
  }

  @Test
  void conditionalTestIsLeftUntouched() {
    Expr test = fn(List.of("y"), var("y"));
    Expr cond = new ConvertedConditional(test, num(1), fn(List.of("z"), var("z")));
    ConvertedConditional out = (ConvertedConditional) Thunkifier.thunkify(cond);
    assertSame(test, out.test());
    assertEquals(fn(List.of("z"), Abstraction.thunk(var("z"))), out.alt());
  }

  @Test
  void unconvertedNodesAreInvariantViolations() {
    assertThrows(InvariantViolationException.class,
        () -> Thunkifier.thunkify(new TrivialConditional(bool(true), num(1), num(2))));
    assertThrows(InvariantViolationException.class,
        () -> Thunkifier.thunkify(new Continuation("x", var("x"))));
  }

  @Test
  void targetNodesAreMalformed() {
    assertThrows(MalformedExpressionException.class, () -> Thunkifier.thunkify(new NewFlag()));
  }
}
