package tailcall.truffle;

import tailcall.truffle.runtime.TailcallConfig;
import com.oracle.truffle.api.TruffleLanguage;
import com.oracle.truffle.api.TruffleLanguage.ContextReference;
import com.oracle.truffle.api.nodes.Node;
import java.util.Objects;

/**
 * Tailcall 语言运行时上下文。
 *
 * 封装 Truffle 环境与配置快照。
 */
public final class TailcallContext {
  private static final ContextReference<TailcallContext> REFERENCE = ContextReference.create(TailcallLanguage.class);

  private final TruffleLanguage.Env env;
  private final ConfigView configView;

  public TailcallContext(TruffleLanguage.Env env) {
    this.env = Objects.requireNonNull(env, "env");
    // 预先捕捉静态配置，避免执行过程中反复读取环境变量
    this.configView = new ConfigView(TailcallConfig.DEBUG, TailcallConfig.PROFILE, TailcallConfig.MODE);
  }

  public static TailcallContext get(Node node) {
    return REFERENCE.get(node);
  }

  public TruffleLanguage.Env getEnv() {
    return env;
  }

  public ConfigView getConfig() {
    return configView;
  }

  /**
   * 配置快照，仅包含运行时常用的几个开关。
   */
  public static final class ConfigView {
    private final boolean debugEnabled;
    private final boolean profileEnabled;
    private final String defaultMode;

    private ConfigView(boolean debugEnabled, boolean profileEnabled, String defaultMode) {
      this.debugEnabled = debugEnabled;
      this.profileEnabled = profileEnabled;
      this.defaultMode = defaultMode;
    }

    public boolean isDebugEnabled() {
      return debugEnabled;
    }

    public boolean isProfileEnabled() {
      return profileEnabled;
    }

    public String getDefaultMode() {
      return defaultMode;
    }
  }
}
