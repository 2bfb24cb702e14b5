package tailcall.truffle.runtime;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;

/**
 * Tailcall 运行时配置
 *
 * 环境变量在类加载时读取一次，热路径中不再调用 System.getenv。
 */
public final class TailcallConfig {
  private TailcallConfig() {}

  /**
   * 调试模式开关
   * 环境变量：TAILCALL_DEBUG
   */
  @CompilationFinal
  public static final boolean DEBUG = System.getenv("TAILCALL_DEBUG") != null;

  /**
   * 性能统计开关，启用时 Runner 在程序结束后打印计数器
   * 环境变量：TAILCALL_PROFILE
   */
  @CompilationFinal
  public static final boolean PROFILE = System.getenv("TAILCALL_PROFILE") != null;

  /**
   * 未指定 MIME 类型时的执行模式：compile（默认）或 direct
   * 环境变量：TAILCALL_MODE
   */
  @CompilationFinal
  public static final String MODE = getEnvOrDefault("TAILCALL_MODE", "compile");

  public static boolean isDirectByDefault() {
    return "direct".equalsIgnoreCase(MODE);
  }

  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }
}
