package tailcall.truffle;

import tailcall.truffle.ast.Expr;
import tailcall.truffle.runtime.ErrorMessages;

/**
 * 某个阶段收到了前一阶段不应产生的形状，属于编译器缺陷。
 */
public class InvariantViolationException extends TailcallException {

  private static final long serialVersionUID = 1L;

  private final transient Expr node;

  public InvariantViolationException(String message, Expr node) {
    super(ErrorMessages.invariantViolation(message, String.valueOf(node)));
    this.node = node;
  }

  public Expr getNode() {
    return node;
  }
}
