package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 运行时内建过程：共享的蹦床驱动器与续延分派器。
 */
public record Intrinsic(Kind kind) implements Expr {

  public enum Kind {
    /** {@code (tramp thunk flag)}：循环强制 thunk 直到标志置位 */
    TRAMPOLINE,
    /** {@code (apply-k value k)}：区分最终结果与中间结果 */
    APPLY_CONTINUATION
  }

  public Intrinsic {
    Objects.requireNonNull(kind, "kind");
  }

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
