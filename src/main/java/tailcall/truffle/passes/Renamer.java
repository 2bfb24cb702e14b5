package tailcall.truffle.passes;

import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Let;
import tailcall.truffle.ast.LocalFunction;
import tailcall.truffle.ast.Variable;
import tailcall.truffle.ast.Walk;

/**
 * 避免捕获的改名：把 {@code from} 的自由出现改为 {@code to}。
 *
 * 遇到重新绑定 {@code from} 的绑定形式时停止下降。{@code to} 必须是新鲜名字。
 */
public final class Renamer {

  private Renamer() {}

  public static Expr rename(Expr expr, String from, String to) {
    if (expr instanceof Variable v) {
      return v.name().equals(from) ? new Variable(to) : v;
    }
    if (expr instanceof Abstraction a && a.params().contains(from)) {
      return a;
    }
    if (expr instanceof Definition d && d.params().contains(from)) {
      return d;
    }
    if (expr instanceof Continuation c && c.param().equals(from)) {
      return c;
    }
    if (expr instanceof Let let && let.name().equals(from)) {
      return new Let(let.name(), rename(let.value(), from, to), let.body());
    }
    if (expr instanceof LocalFunction fn) {
      if (fn.name().equals(from)) {
        return fn;
      }
      Expr body = fn.params().contains(from) ? fn.functionBody() : rename(fn.functionBody(), from, to);
      return new LocalFunction(fn.name(), fn.params(), body, rename(fn.scope(), from, to));
    }
    return Walk.map(expr, child -> rename(child, from, to));
  }
}
