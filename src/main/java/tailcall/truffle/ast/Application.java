package tailcall.truffle.ast;

import tailcall.truffle.InvariantViolationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 函数调用。CPS 转换之后，最后一个实参总是续延。
 */
public record Application(Expr operator, List<Expr> operands) implements Expr {

  public Application {
    Objects.requireNonNull(operator, "operator");
    operands = List.copyOf(operands);
  }

  /** CPS 约定下的续延实参（最后一个实参） */
  public Expr continuation() {
    if (operands.isEmpty()) {
      throw new InvariantViolationException("Application has no continuation slot", this);
    }
    return operands.get(operands.size() - 1);
  }

  /** CPS 约定下除续延外的实参 */
  public List<Expr> arguments() {
    return operands.isEmpty() ? operands : operands.subList(0, operands.size() - 1);
  }

  @Override
  public Stage stage() {
    return Stage.SHARED;
  }

  @Override
  public List<Expr> children() {
    List<Expr> children = new ArrayList<>(operands.size() + 1);
    children.add(operator);
    children.addAll(operands);
    return List.copyOf(children);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, operands.size() + 1);
    return new Application(children.get(0), children.subList(1, children.size()));
  }
}
