package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 已完成 CPS 转换的条件表达式，子节点均已转换。
 */
public record ConvertedConditional(Expr test, Expr conseq, Expr alt) implements Conditional {

  public ConvertedConditional {
    Objects.requireNonNull(test, "test");
    Objects.requireNonNull(conseq, "conseq");
    Objects.requireNonNull(alt, "alt");
  }

  @Override
  public Stage stage() {
    return Stage.CPS;
  }

  @Override
  public List<Expr> children() {
    return List.of(test, conseq, alt);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 3);
    return new ConvertedConditional(children.get(0), children.get(1), children.get(2));
  }
}
