package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 局部函数：{@code name} 只在函数体自身与 {@code scope} 中可见。
 */
public record LocalFunction(String name, List<String> params, Expr functionBody, Expr scope)
    implements Expr {

  public LocalFunction {
    Names.requireValid(name);
    params = Names.requireParams(params);
    Objects.requireNonNull(functionBody, "functionBody");
    Objects.requireNonNull(scope, "scope");
  }

  @Override
  public Stage stage() {
    return Stage.TARGET;
  }

  @Override
  public List<Expr> children() {
    return List.of(functionBody, scope);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 2);
    return new LocalFunction(name, params, children.get(0), children.get(1));
  }
}
