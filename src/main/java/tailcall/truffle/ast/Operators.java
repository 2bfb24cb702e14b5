package tailcall.truffle.ast;

import java.util.Set;

/**
 * 平凡运算符集合。平凡运算总是立即求值、结果可安全复制，不需要续延。
 */
public final class Operators {

  public static final Set<String> TRIVIAL = Set.of(
      "+", "-", "*", "/", "mod",
      "=", "<", ">", "<=", ">=",
      "not", "zero?", "inc", "dec", "even?", "odd?");

  private Operators() {}

  public static boolean isTrivial(String op) {
    return op != null && TRIVIAL.contains(op);
  }
}
