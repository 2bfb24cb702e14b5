package tailcall.truffle.passes;

import static org.junit.jupiter.api.Assertions.*;
import static tailcall.truffle.ast.Trees.*;

import tailcall.truffle.InvariantViolationException;
import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Let;
import tailcall.truffle.ast.LocalFunction;
import tailcall.truffle.ast.NewFlag;
import tailcall.truffle.ast.TerminalContinuation;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrampolineInserterTest {

  private FreshNames names;
  private Definition thunked;

  @BeforeEach
  void setUp() {
    names = new FreshNames();
    Definition cps = new CpsConverter(names).convertDefinition(countdown());
    thunked = (Definition) Thunkifier.thunkify(new ContinuationAbstraction("apply-k").apply(cps));
  }

  @Test
  void definitionGetsFlagLocalFunctionAndDriverLoop() {
    Definition out = (Definition) new TrampolineInserter(names, "tramp", "apply-k").insert(thunked);

    assertEquals("countdown", out.name());
    assertEquals(List.of("n", "k$2"), out.params());

    Let let = assertInstanceOf(Let.class, out.body());
    assertEquals("flag$3", let.name());
    assertInstanceOf(NewFlag.class, let.value());

    LocalFunction local = assertInstanceOf(LocalFunction.class, let.body());
    assertEquals("countdown$1", local.name());
    assertEquals(List.of("n", "k$2"), local.params());
    assertSame(thunked.body(), local.functionBody());
    assertTrue(((Abstraction) local.functionBody()).isThunk());

    Expr expectedScope = call("apply-k",
        call("tramp",
            call("countdown$1", var("n"), new TerminalContinuation(var("flag$3"))),
            var("flag$3")),
        var("k$2"));
    assertEquals(expectedScope, local.scope());
  }

  @Test
  void eachDefinitionOwnsItsOwnFlag() {
    TrampolineInserter inserter = new TrampolineInserter(names, "tramp", "apply-k");
    Let first = (Let) ((Definition) inserter.insert(thunked)).body();
    Let second = (Let) ((Definition) inserter.insert(thunked)).body();
    assertNotEquals(first.name(), second.name());
  }

  @Test
  void nonDefinitionFormsAreUnchanged() {
    Application app = call("entry$1", new TerminalContinuation(new NewFlag()));
    assertSame(app, new TrampolineInserter(names, "tramp", "apply-k").insert(app));
  }

  @Test
  void unconvertedDefinitionIsAnInvariantViolation() {
    assertThrows(InvariantViolationException.class,
        () -> new TrampolineInserter(names, "tramp", "apply-k").insert(countdown()));
  }
}
