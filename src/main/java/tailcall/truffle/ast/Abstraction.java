package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 匿名函数。参数列表可以为空（零参数函数即挂起的计算，thunk）。
 */
public record Abstraction(List<String> params, Expr body) implements Expr {

  public Abstraction {
    params = Names.requireParams(params);
    Objects.requireNonNull(body, "body");
  }

  /** 零参数函数 */
  public static Abstraction thunk(Expr body) {
    return new Abstraction(List.of(), body);
  }

  public boolean isThunk() {
    return params.isEmpty();
  }

  @Override
  public Stage stage() {
    return Stage.SHARED;
  }

  @Override
  public List<Expr> children() {
    return List.of(body);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 1);
    return new Abstraction(params, children.get(0));
  }
}
