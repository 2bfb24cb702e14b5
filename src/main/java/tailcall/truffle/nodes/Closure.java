package tailcall.truffle.nodes;

import tailcall.truffle.runtime.Builtins;
import tailcall.truffle.runtime.Procedure;
import tailcall.truffle.runtime.TailcallConfig;
import com.oracle.truffle.api.CallTarget;
import com.oracle.truffle.api.interop.InteropLibrary;
import com.oracle.truffle.api.library.ExportLibrary;
import com.oracle.truffle.api.library.ExportMessage;
import java.util.List;

/**
 * 闭包值，实现 Truffle InteropLibrary 使其可从 Polyglot 调用
 *
 * 调用约定：CallTarget 的实参为 {@code [捕获环境, 实参...]}，由 {@link LambdaRootNode} 解包。
 */
@ExportLibrary(InteropLibrary.class)
public final class Closure implements Procedure {
  private final String name;
  private final List<String> params;
  private final Env env;
  private final CallTarget callTarget;

  public Closure(String name, List<String> params, Env env, CallTarget callTarget) {
    this.name = name;
    this.params = params;
    this.env = env;
    this.callTarget = callTarget;
  }

  public String getName() {
    return name;
  }

  public List<String> getParams() {
    return params;
  }

  public CallTarget getCallTarget() {
    return callTarget;
  }

  /**
   * 把捕获环境放到实参数组首位。
   */
  public Object[] pack(Object[] args) {
    Object[] packed = new Object[args.length + 1];
    packed[0] = env;
    System.arraycopy(args, 0, packed, 1, args.length);
    return packed;
  }

  @Override
  public Object invoke(Object[] args) {
    Profiler.inc("closure_invoke");
    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: invoke " + name + " args.length=" + args.length);
    }
    return callTarget.call(pack(args));
  }

  // ==================== Truffle InteropLibrary 实现 ====================

  @ExportMessage
  boolean isExecutable() {
    return true;
  }

  @ExportMessage
  Object execute(Object[] args) {
    Object[] normalized = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      normalized[i] = Builtins.normalize(args[i]);
    }
    return invoke(normalized);
  }

  @Override
  public String toString() {
    return "Closure(" + name + ", params=" + params + ")";
  }
}
