package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 测试或分支需要求值（需要显式传递续延）的条件表达式。
 */
public record SeriousConditional(Expr test, Expr conseq, Expr alt) implements Conditional {

  public SeriousConditional {
    Objects.requireNonNull(test, "test");
    Objects.requireNonNull(conseq, "conseq");
    Objects.requireNonNull(alt, "alt");
  }

  @Override
  public Stage stage() {
    return Stage.SURFACE;
  }

  @Override
  public List<Expr> children() {
    return List.of(test, conseq, alt);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 3);
    return new SeriousConditional(children.get(0), children.get(1), children.get(2));
  }
}
