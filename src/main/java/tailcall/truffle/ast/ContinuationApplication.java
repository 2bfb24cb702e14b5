package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 把一个值交给续延。
 */
public record ContinuationApplication(Expr continuation, Expr argument) implements Expr {

  public ContinuationApplication {
    Objects.requireNonNull(continuation, "continuation");
    Objects.requireNonNull(argument, "argument");
  }

  @Override
  public Stage stage() {
    return Stage.CPS;
  }

  @Override
  public List<Expr> children() {
    return List.of(continuation, argument);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 2);
    return new ContinuationApplication(children.get(0), children.get(1));
  }
}
