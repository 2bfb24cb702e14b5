package tailcall.truffle.runtime;

/**
 * 错误消息统一生成工具。
 *
 * <p>编译期与运行期错误消息均提供中英文双语描述并附带恢复提示。
 * 英文部分保留稳定的关键字，测试只依赖英文关键字。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示，提示部分同样采用中英文双语。
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  // ==================== 编译期 ====================

  /**
   * 构造表达式格式错误消息。
   *
   * @param detail 英文细节
   * @param node 出错节点描述
   */
  public static String malformedExpression(String detail, String node) {
    String english = "Malformed expression: " + detail + " in " + node;
    String message = bilingual("表达式格式错误：" + detail + "，位于 " + node, english);
    return withHint(message, "只使用受支持的节点类型与平凡运算符", "Use only the supported node kinds and trivial operators");
  }

  /**
   * 构造编译器内部不变量被破坏的错误消息。
   */
  public static String invariantViolation(String detail, String node) {
    String english = "Internal invariant violated: " + detail + " at " + node;
    String message = bilingual("编译器内部不变量被破坏：" + detail + "，位于 " + node, english);
    return withHint(message, "这是编译器缺陷，请附带输入程序报告", "This is a compiler bug; report it with the input program");
  }

  // ==================== 运行期 ====================

  /**
   * 构造除零算术错误消息。
   */
  public static String arithmeticDivisionByZero() {
    String message = bilingual("算术错误：除数为 0", "division by zero");
    return withHint(message, "检查输入参数，确保除数非 0", "Check the divisor and ensure it is non-zero");
  }

  /**
   * 构造模运算除零的错误消息。
   */
  public static String arithmeticModuloByZero() {
    String message = bilingual("算术错误：模运算除数为 0", "modulo by zero");
    return withHint(message, "校验模运算分母，避免为 0", "Validate the modulo divisor to avoid zero");
  }

  /**
   * 构造整数溢出的错误消息。
   */
  public static String arithmeticOverflow(String operation) {
    String english = operation + ": integer overflow";
    String message = bilingual("算术错误：整数溢出（" + operation + "）", english);
    return withHint(message, "缩小输入范围或改用小数", "Reduce the input range or use decimals");
  }

  /**
   * 构造操作类型不匹配的错误消息。
   *
   * @param operation 操作名称
   * @param expected 期望的类型描述
   * @param actual 实际值
   */
  public static String operationExpectedType(String operation, String expected, Object actual) {
    String actualDesc = describe(actual);
    String english = operation + ": expected " + expected + ", got " + actualDesc;
    String message = bilingual("操作 " + operation + " 期望类型 " + expected + "，实际为 " + actualDesc, english);
    return withHint(message, "核对参数或调用结果，确保类型匹配", "Verify arguments or results to ensure type compatibility");
  }

  /**
   * 构造调用非函数值的错误消息。
   */
  public static String notAFunction(Object value) {
    String english = "not a function: " + describe(value);
    String message = bilingual("调用目标不是函数：" + describe(value), english);
    return withHint(message, "确认调用位置的表达式求值为函数", "Make sure the operator evaluates to a function");
  }

  /**
   * 构造参数个数不匹配的错误消息。
   */
  public static String arityMismatch(String name, int expected, int actual) {
    String english = "arity mismatch: " + name + " expects " + expected + " arguments, got " + actual;
    String message = bilingual("参数个数不匹配：" + name + " 需要 " + expected + " 个参数，实际 " + actual, english);
    return withHint(message, "检查调用处的实参数量", "Check the number of arguments at the call site");
  }

  /**
   * 构造变量未绑定的错误消息。
   */
  public static String unboundVariable(String name) {
    String english = "unbound variable: " + name;
    String message = bilingual("变量未绑定：" + name, english);
    return withHint(message, "确保在使用前定义该名字", "Define the name before using it");
  }

  /**
   * 构造蹦床在标志未置位时得到非 thunk 值的错误消息。
   */
  public static String trampolineStalled(Object value) {
    String english = "trampoline expected a suspension, got " + describe(value);
    String message = bilingual("蹦床期望得到挂起计算，实际为 " + describe(value), english);
    return withHint(message, "该程序可能未经过 thunk 化，请重新编译", "The program may not be thunkified; recompile it");
  }

  private static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    return value.getClass().getSimpleName() + ":" + value;
  }
}
