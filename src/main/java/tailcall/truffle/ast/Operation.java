package tailcall.truffle.ast;

import tailcall.truffle.MalformedExpressionException;
import java.util.List;

/**
 * 平凡运算：运算符必须属于 {@link Operators#TRIVIAL}。
 */
public record Operation(String op, List<Expr> operands) implements Expr {

  public Operation {
    if (!Operators.isTrivial(op)) {
      throw new MalformedExpressionException("Unsupported primitive operator: " + op, String.valueOf(op));
    }
    operands = List.copyOf(operands);
  }

  @Override
  public Stage stage() {
    return Stage.SHARED;
  }

  @Override
  public List<Expr> children() {
    return operands;
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, operands.size());
    return new Operation(op, children);
  }
}
