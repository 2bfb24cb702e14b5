package tailcall.truffle.runtime;

import java.util.*;

/**
 * 平凡运算符注册表。
 *
 * 数值只有 {@link Long} 与 {@link Double} 两种；整数运算溢出、除数为 0 都报告为运行期错误。
 * 真值判断沿用源语言约定：只有 {@code false} 为假。
 */
public final class Builtins {

  @FunctionalInterface
  public interface BuiltinFunction {
    Object call(Object[] args) throws BuiltinException;
  }

  public static final class BuiltinException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    public BuiltinException(String message) { super(message); }
    public BuiltinException(String message, Throwable cause) { super(message, cause); }
  }

  private static final Map<String, BuiltinFunction> REGISTRY = new HashMap<>();

  static {
    // === 算术 ===
    register("+", args -> {
      Object acc = 0L;
      for (Object a : args) acc = add("+", acc, num("+", a));
      return acc;
    });

    register("*", args -> {
      Object acc = 1L;
      for (Object a : args) acc = mul("*", acc, num("*", a));
      return acc;
    });

    register("-", args -> {
      checkArity("-", args, 1, Integer.MAX_VALUE);
      if (args.length == 1) return sub("-", 0L, num("-", args[0]));
      Object acc = num("-", args[0]);
      for (int i = 1; i < args.length; i++) acc = sub("-", acc, num("-", args[i]));
      return acc;
    });

    register("/", args -> {
      checkArity("/", args, 1, Integer.MAX_VALUE);
      if (args.length == 1) return div(1L, num("/", args[0]));
      Object acc = num("/", args[0]);
      for (int i = 1; i < args.length; i++) acc = div(acc, num("/", args[i]));
      return acc;
    });

    register("mod", args -> {
      checkArity("mod", args, 2, 2);
      Object a = num("mod", args[0]);
      Object b = num("mod", args[1]);
      if (isZero(b)) throw new BuiltinException(ErrorMessages.arithmeticModuloByZero());
      if (a instanceof Long x && b instanceof Long y) return Math.floorMod(x, y);
      double x = toDouble(a);
      double y = toDouble(b);
      return x - y * Math.floor(x / y);
    });

    register("inc", args -> {
      checkArity("inc", args, 1, 1);
      return add("inc", num("inc", args[0]), 1L);
    });

    register("dec", args -> {
      checkArity("dec", args, 1, 1);
      return sub("dec", num("dec", args[0]), 1L);
    });

    // === 比较 ===
    register("=", args -> {
      checkArity("=", args, 1, Integer.MAX_VALUE);
      for (int i = 1; i < args.length; i++) {
        if (!equal(args[i - 1], args[i])) return false;
      }
      return true;
    });

    register("<", args -> chain("<", args, c -> c < 0));
    register(">", args -> chain(">", args, c -> c > 0));
    register("<=", args -> chain("<=", args, c -> c <= 0));
    register(">=", args -> chain(">=", args, c -> c >= 0));

    // === 谓词 ===
    register("not", args -> {
      checkArity("not", args, 1, 1);
      return !isTruthy(args[0]);
    });

    register("zero?", args -> {
      checkArity("zero?", args, 1, 1);
      return isZero(num("zero?", args[0]));
    });

    register("even?", args -> {
      checkArity("even?", args, 1, 1);
      return integer("even?", args[0]) % 2 == 0;
    });

    register("odd?", args -> {
      checkArity("odd?", args, 1, 1);
      return integer("odd?", args[0]) % 2 != 0;
    });
  }

  private Builtins() {}

  public static void register(String name, BuiltinFunction fn) {
    REGISTRY.put(name, fn);
  }

  public static boolean has(String name) {
    return REGISTRY.containsKey(name);
  }

  public static BuiltinFunction lookup(String name) {
    return REGISTRY.get(name);
  }

  public static Object call(String name, Object[] args) throws BuiltinException {
    BuiltinFunction fn = REGISTRY.get(name);
    if (fn == null) {
      throw new BuiltinException("unknown operator: " + name);
    }
    return fn.call(args);
  }

  /** 只有 {@code false} 为假 */
  public static boolean isTruthy(Object value) {
    return !(value instanceof Boolean b) || b;
  }

  /**
   * 把来自宿主的数值统一为 {@link Long} 或 {@link Double}。
   */
  public static Object normalize(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    return value;
  }

  private static Object add(String op, Object a, Object b) {
    if (a instanceof Long x && b instanceof Long y) {
      try {
        return Math.addExact(x, y);
      } catch (ArithmeticException e) {
        throw new BuiltinException(ErrorMessages.arithmeticOverflow(op), e);
      }
    }
    return toDouble(a) + toDouble(b);
  }

  private static Object sub(String op, Object a, Object b) {
    if (a instanceof Long x && b instanceof Long y) {
      try {
        return Math.subtractExact(x, y);
      } catch (ArithmeticException e) {
        throw new BuiltinException(ErrorMessages.arithmeticOverflow(op), e);
      }
    }
    return toDouble(a) - toDouble(b);
  }

  private static Object mul(String op, Object a, Object b) {
    if (a instanceof Long x && b instanceof Long y) {
      try {
        return Math.multiplyExact(x, y);
      } catch (ArithmeticException e) {
        throw new BuiltinException(ErrorMessages.arithmeticOverflow(op), e);
      }
    }
    return toDouble(a) * toDouble(b);
  }

  /** 整数整除时结果仍为整数，否则为小数 */
  private static Object div(Object a, Object b) {
    if (isZero(b)) throw new BuiltinException(ErrorMessages.arithmeticDivisionByZero());
    if (a instanceof Long x && b instanceof Long y && x % y == 0) {
      return x / y;
    }
    return toDouble(a) / toDouble(b);
  }

  private static boolean chain(String op, Object[] args, java.util.function.IntPredicate accept) {
    checkArity(op, args, 1, Integer.MAX_VALUE);
    for (int i = 1; i < args.length; i++) {
      if (!accept.test(compare(num(op, args[i - 1]), num(op, args[i])))) return false;
    }
    return true;
  }

  private static int compare(Object a, Object b) {
    if (a instanceof Long x && b instanceof Long y) return Long.compare(x, y);
    return Double.compare(toDouble(a), toDouble(b));
  }

  private static boolean equal(Object a, Object b) {
    Object x = normalize(a);
    Object y = normalize(b);
    if (x instanceof Number && y instanceof Number) return compare(x, y) == 0;
    return Objects.equals(x, y);
  }

  private static boolean isZero(Object n) {
    return n instanceof Long l ? l == 0L : toDouble(n) == 0.0;
  }

  private static Object num(String op, Object value) {
    Object v = normalize(value);
    if (v instanceof Long || v instanceof Double) return v;
    throw new BuiltinException(ErrorMessages.operationExpectedType(op, "Number", value));
  }

  private static long integer(String op, Object value) {
    Object v = normalize(value);
    if (v instanceof Long l) return l;
    throw new BuiltinException(ErrorMessages.operationExpectedType(op, "Integer", value));
  }

  private static double toDouble(Object n) {
    return ((Number) n).doubleValue();
  }

  private static void checkArity(String name, Object[] args, int min, int max) {
    if (args.length < min || args.length > max) {
      throw new BuiltinException(ErrorMessages.arityMismatch(name, min, args.length));
    }
  }
}
