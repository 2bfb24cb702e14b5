package tailcall.truffle.passes;

import static org.junit.jupiter.api.Assertions.*;
import static tailcall.truffle.ast.Trees.*;

import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.ContinuationApplication;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Walk;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContinuationAbstractionTest {

  private final ContinuationAbstraction pass = new ContinuationAbstraction("apply-k");

  @Test
  void continuationApplicationBecomesDispatcherCall() {
    Expr out = pass.apply(new ContinuationApplication(var("k"), num(1)));
    assertEquals(call("apply-k", num(1), var("k")), out, "续延保持在最后一个实参位置");
  }

  @Test
  void continuationBecomesSingleParameterFunction() {
    Expr out = pass.apply(new Continuation("s", new ContinuationApplication(var("k"), var("s"))));
    assertEquals(new Abstraction(List.of("s"), call("apply-k", var("s"), var("k"))), out);
  }

  @Test
  void identityOnContinuationFreeTrees() {
    Expr tree = countdown();
    assertEquals(tree, pass.apply(tree));
  }

  @Test
  void idempotentAfterFirstApplication() {
    Definition converted = new CpsConverter(new FreshNames()).convertDefinition(countdown());
    Expr once = pass.apply(converted);
    assertEquals(once, pass.apply(once));
    assertFalse(Walk.anyMatch(once, n -> n instanceof Continuation || n instanceof ContinuationApplication));
  }
}
