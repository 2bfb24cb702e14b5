package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 具体化的“剩余计算”，恰好绑定一个参数。
 */
public record Continuation(String param, Expr body) implements Expr {

  public Continuation {
    Names.requireValid(param);
    Objects.requireNonNull(body, "body");
  }

  @Override
  public Stage stage() {
    return Stage.CPS;
  }

  @Override
  public List<Expr> children() {
    return List.of(body);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 1);
    return new Continuation(param, children.get(0));
  }
}
