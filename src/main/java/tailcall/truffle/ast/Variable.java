package tailcall.truffle.ast;

import java.util.List;

/**
 * 变量引用。
 */
public record Variable(String name) implements Expr {

  public Variable {
    Names.requireValid(name);
  }

  @Override
  public Stage stage() {
    return Stage.SHARED;
  }

  @Override
  public List<Expr> children() {
    return List.of();
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 0);
    return this;
  }
}
