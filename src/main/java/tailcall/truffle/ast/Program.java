package tailcall.truffle.ast;

import tailcall.truffle.MalformedExpressionException;
import java.util.List;

/**
 * 顶层形式序列，仅允许出现在树根。求值结果为最后一个形式的值。
 */
public record Program(List<Expr> forms) implements Expr {

  public Program {
    forms = List.copyOf(forms);
    if (forms.isEmpty()) {
      throw new MalformedExpressionException("Program must contain at least one form", "Program[]");
    }
  }

  @Override
  public Stage stage() {
    return Stage.SHARED;
  }

  @Override
  public List<Expr> children() {
    return forms;
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, forms.size());
    return new Program(children);
  }
}
