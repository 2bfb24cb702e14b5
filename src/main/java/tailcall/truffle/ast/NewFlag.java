package tailcall.truffle.ast;

import java.util.List;

/**
 * 分配一个新的完成标志（初始未置位）。
 */
public record NewFlag() implements Expr {

  @Override
  public Stage stage() {
    return Stage.TARGET;
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
