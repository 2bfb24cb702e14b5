package tailcall.truffle.ast;

import static org.junit.jupiter.api.Assertions.*;
import static tailcall.truffle.ast.Trees.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class WalkTest {

  @Test
  void foldVisitsConditionalChildrenInPositionalOrder() {
    Conditional c = cond(var("t"), var("c"), var("a"));
    List<String> seen = new ArrayList<>();
    Walk.fold(c, child -> {
      seen.add(((Variable) child).name());
      return child;
    }, kids -> kids);
    assertEquals(List.of("t", "c", "a"), seen, "条件的子节点顺序应为测试、真分支、假分支");
  }

  @Test
  void foldVisitsOperatorBeforeOperands() {
    Application a = app(var("f"), var("x"), var("y"));
    List<Expr> kids = Walk.fold(a, child -> child, k -> k);
    assertEquals(List.of(var("f"), var("x"), var("y")), kids);
  }

  @Test
  void foldMayRebuildAsDifferentVariant() {
    TrivialConditional c = new TrivialConditional(bool(true), num(1), num(2));
    Expr rebuilt = Walk.fold(c, child -> child,
        kids -> new ConvertedConditional(kids.get(0), kids.get(1), kids.get(2)));
    assertEquals(new ConvertedConditional(bool(true), num(1), num(2)), rebuilt);
  }

  @Test
  void mapIndexedPassesChildPositions() {
    Application a = app(var("f"), var("x"), var("k"));
    Expr out = Walk.mapIndexed(a, (position, child) -> position == 2 ? num(0) : child);
    assertEquals(app(var("f"), var("x"), num(0)), out, "只替换位置 2 的子节点");
  }

  @Test
  void mapRebuildsSameVariant() {
    Expr e = op("+", var("x"), num(1));
    Expr renamed = Walk.map(e, child -> child instanceof Variable ? var("y") : child);
    assertEquals(op("+", var("y"), num(1)), renamed);
  }

  @Test
  void mapLeavesInputUntouched() {
    Operation original = op("+", var("x"), num(1));
    Walk.map(original, child -> num(9));
    assertEquals(op("+", var("x"), num(1)), original, "变换不应修改输入树");
  }

  @Test
  void bottomUpRewritesChildrenFirst() {
    Expr tree = op("+", op("+", num(1), num(2)), num(3));
    List<String> order = new ArrayList<>();
    Walk.bottomUp(tree, node -> {
      order.add(node.getClass().getSimpleName());
      return node;
    });
    assertEquals(List.of("Literal", "Literal", "Operation", "Literal", "Operation"), order);
  }

  @Test
  void countAndAnyMatchIncludeRoot() {
    Expr tree = app(var("f"), var("x"), fn(List.of("y"), var("y")));
    assertEquals(3, Walk.count(tree, n -> n instanceof Variable));
    assertTrue(Walk.anyMatch(tree, n -> n instanceof Application));
    assertFalse(Walk.anyMatch(tree, n -> n instanceof Continuation));
  }

  @Test
  void rebuildWithWrongChildCountIsAnInvariantViolation() {
    Expr e = op("+", num(1), num(2));
    assertThrows(tailcall.truffle.InvariantViolationException.class, () -> e.withChildren(List.of(num(1))));
  }
}
