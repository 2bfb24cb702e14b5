package tailcall.truffle.ast;

import tailcall.truffle.MalformedExpressionException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 标识符校验工具。
 */
public final class Names {

  /** 生成名专用分隔符，用户标识符中禁止出现 */
  public static final char GENERATED_SEPARATOR = '$';

  private Names() {}

  static String requireValid(String name) {
    if (name == null || name.isBlank()) {
      throw new MalformedExpressionException("Identifier must not be blank", String.valueOf(name));
    }
    return name;
  }

  static List<String> requireParams(List<String> params) {
    if (params == null) {
      throw new MalformedExpressionException("Parameter list must not be null", "null");
    }
    List<String> copy = new ArrayList<>(params.size());
    Set<String> seen = new HashSet<>();
    for (String p : params) {
      requireValid(p);
      if (!seen.add(p)) {
        throw new MalformedExpressionException("Duplicate parameter: " + p, params.toString());
      }
      copy.add(p);
    }
    return List.copyOf(copy);
  }

  /**
   * 判断名字是否由 {@code FreshNames} 生成。
   */
  public static boolean isGenerated(String name) {
    return name.indexOf(GENERATED_SEPARATOR) >= 0;
  }
}
