package tailcall.truffle.passes;

import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.ContinuationApplication;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Variable;
import tailcall.truffle.ast.Walk;
import java.util.List;

/**
 * 把续延节点改写为普通函数与普通调用。
 *
 * {@code (k v)} 变为 {@code (apply-k v k)}，续延仍位于最后一个实参位置；
 * 续延 {@code (fn [x] b)} 变为单参数函数。对不含续延节点的树是恒等变换。
 */
public final class ContinuationAbstraction {
  private final String applyK;

  public ContinuationAbstraction(String applyK) {
    this.applyK = applyK;
  }

  public Expr apply(Expr expr) {
    return Walk.bottomUp(expr, this::rewrite);
  }

  private Expr rewrite(Expr node) {
    if (node instanceof ContinuationApplication ka) {
      return new Application(new Variable(applyK), List.of(ka.argument(), ka.continuation()));
    }
    if (node instanceof Continuation k) {
      return new Abstraction(List.of(k.param()), k.body());
    }
    return node;
  }
}
