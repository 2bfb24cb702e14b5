package tailcall.truffle.ast;

import java.util.List;
import java.util.Objects;

/**
 * 命名的顶层函数定义。
 *
 * {@code selfName} 在源树中为 null；CPS 转换把函数体中的自引用改名为一个新鲜名字并记录在此，
 * 蹦床插入阶段用它命名局部函数。
 */
public record Definition(String name, List<String> params, Expr body, String selfName) implements Expr {

  public Definition {
    Names.requireValid(name);
    params = Names.requireParams(params);
    Objects.requireNonNull(body, "body");
  }

  public Definition(String name, List<String> params, Expr body) {
    this(name, params, body, null);
  }

  public boolean hasSelfName() {
    return selfName != null;
  }

  public Definition withBody(Expr newBody) {
    return new Definition(name, params, newBody, selfName);
  }

  @Override
  public Stage stage() {
    return Stage.SHARED;
  }

  @Override
  public List<Expr> children() {
    return List.of(body);
  }

  @Override
  public Expr withChildren(List<Expr> children) {
    Expr.requireArity(this, children, 1);
    return withBody(children.get(0));
  }
}
