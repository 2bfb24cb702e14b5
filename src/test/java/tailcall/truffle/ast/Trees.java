package tailcall.truffle.ast;

import java.util.Arrays;
import java.util.List;

/**
 * 测试用的表达式树构造助手。
 */
public final class Trees {
  private Trees() {}

  public static Literal num(long value) {
    return Literal.of(value);
  }

  public static Literal bool(boolean value) {
    return Literal.of(value);
  }

  public static Variable var(String name) {
    return new Variable(name);
  }

  public static Operation op(String op, Expr... operands) {
    return new Operation(op, Arrays.asList(operands));
  }

  public static Application app(Expr operator, Expr... operands) {
    return new Application(operator, Arrays.asList(operands));
  }

  public static Application call(String name, Expr... operands) {
    return app(var(name), operands);
  }

  public static Abstraction fn(List<String> params, Expr body) {
    return new Abstraction(params, body);
  }

  public static Definition defn(String name, List<String> params, Expr body) {
    return new Definition(name, params, body);
  }

  public static Conditional cond(Expr test, Expr conseq, Expr alt) {
    return Conditional.of(test, conseq, alt);
  }

  /** (defn countdown [n] (if (zero? n) 0 (countdown (dec n)))) */
  public static Definition countdown() {
    return defn("countdown", List.of("n"),
        cond(op("zero?", var("n")), num(0), call("countdown", op("dec", var("n")))));
  }
}
