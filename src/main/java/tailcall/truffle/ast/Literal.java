package tailcall.truffle.ast;

import tailcall.truffle.MalformedExpressionException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * 字面量：布尔值或数字。
 *
 * 整数统一规范化为 {@link Long}，小数统一规范化为 {@link Double}。
 */
public record Literal(Object value) implements Expr {

  public Literal {
    value = normalize(value);
  }

  public static Literal of(boolean value) {
    return new Literal(value);
  }

  public static Literal of(long value) {
    return new Literal(value);
  }

  public static Literal of(double value) {
    return new Literal(value);
  }

  private static Object normalize(Object value) {
    if (value instanceof Boolean || value instanceof Long || value instanceof Double) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    if (value instanceof BigInteger big && big.bitLength() < 64) {
      return big.longValue();
    }
    if (value instanceof BigDecimal dec) {
      return dec.doubleValue();
    }
    throw new MalformedExpressionException(
        "Literal must be a boolean or a number", String.valueOf(value));
  }

  @Override
  public Stage stage() {
    return Stage.SHARED;
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
