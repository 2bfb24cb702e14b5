package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 词法绑定：在 {@code body} 中把 {@code name} 绑定为 {@code value} 的值。
 */
public record Let(String name, Expr value, Expr body) implements Expr {

  public Let {
    Names.requireValid(name);
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(body, "body");
  }

  @Override
  public Stage stage() {
    return Stage.TARGET;
  }

  @Override
  public List<Expr> children() {
    return List.of(value, body);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 2);
    return new Let(name, children.get(0), children.get(1));
  }
}
