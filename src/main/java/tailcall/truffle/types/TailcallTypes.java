package tailcall.truffle.types;

import tailcall.truffle.nodes.Closure;
import com.oracle.truffle.api.dsl.ImplicitCast;
import com.oracle.truffle.api.dsl.TypeSystem;

/**
 * 运行时的核心值类型：整数、小数、布尔与闭包。
 */
@TypeSystem({
    long.class,
    double.class,
    boolean.class,
    Closure.class
})
public abstract class TailcallTypes {
  protected TailcallTypes() {}

  @ImplicitCast
  public static double castLongToDouble(long value) {
    return value;
  }
}
