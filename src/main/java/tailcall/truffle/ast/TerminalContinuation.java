package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 一次激活的最终续延：值到达这里即为最终结果，并置位 {@code flag}。
 */
public record TerminalContinuation(Expr flag) implements Expr {

  public TerminalContinuation {
    Objects.requireNonNull(flag, "flag");
  }

  @Override
  public Stage stage() {
    return Stage.TARGET;
  }

  @Override
  public List<Expr> children() {
    return List.of(flag);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 1);
    return new TerminalContinuation(children.get(0));
  }
}
