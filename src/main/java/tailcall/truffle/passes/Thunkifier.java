package tailcall.truffle.passes;

import tailcall.truffle.InvariantViolationException;
import tailcall.truffle.MalformedExpressionException;
import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.ContinuationApplication;
import tailcall.truffle.ast.ConvertedConditional;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Literal;
import tailcall.truffle.ast.Operation;
import tailcall.truffle.ast.Program;
import tailcall.truffle.ast.SeriousConditional;
import tailcall.truffle.ast.Stage;
import tailcall.truffle.ast.TrivialConditional;
import tailcall.truffle.ast.Variable;
import tailcall.truffle.ast.Walk;

/**
 * Thunk 化：每个函数体都被包进零参数函数。
 *
 * 调用这样的函数只返回一个挂起计算，由蹦床驱动器负责强制求值，
 * 因此函数体内的尾调用不会在宿主栈上累积。
 */
public final class Thunkifier {

  private Thunkifier() {}

  public static Expr thunkify(Expr expr) {
    if (expr instanceof Literal || expr instanceof Variable) {
      return expr;
    }
    if (expr instanceof Operation || expr instanceof Program) {
      return Walk.map(expr, Thunkifier::thunkify);
    }
    if (expr instanceof ConvertedConditional cond) {
      // 位置 0 是测试，保持原样
      return Walk.mapIndexed(cond, (position, child) -> position == 0 ? child : thunkify(child));
    }
    if (expr instanceof Abstraction fn) {
      return Walk.fold(fn, Thunkifier::thunkify, kids -> new Abstraction(fn.params(), Abstraction.thunk(kids.get(0))));
    }
    if (expr instanceof Definition def) {
      return Walk.fold(def, Thunkifier::thunkify, kids -> def.withBody(Abstraction.thunk(kids.get(0))));
    }
    if (expr instanceof Application app) {
      int continuationSlot = app.children().size() - 1;
      return Walk.mapIndexed(app, (position, child) ->
          position == continuationSlot && position > 0 ? thunkifyContinuation(child) : thunkify(child));
    }
    if (expr instanceof TrivialConditional || expr instanceof SeriousConditional
        || expr instanceof Continuation || expr instanceof ContinuationApplication) {
      throw new InvariantViolationException("Unconverted node reached thunkification", expr);
    }
    if (expr.stage() == Stage.TARGET) {
      throw new MalformedExpressionException("Target-only node in thunkification input", expr);
    }
    throw new MalformedExpressionException("Unrecognized expression in thunkification", expr);
  }

  /**
   * 续延实参内部照常 thunk 化，但续延本身不再包一层挂起：分派器已经用挂起计算包装了它的调用。
   */
  private static Expr thunkifyContinuation(Expr k) {
    if (k instanceof Abstraction fn) {
      return Walk.map(fn, Thunkifier::thunkify);
    }
    return thunkify(k);
  }
}
