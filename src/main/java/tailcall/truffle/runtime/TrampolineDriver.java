package tailcall.truffle.runtime;

import tailcall.truffle.nodes.Profiler;
import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;

/**
 * 共享的蹦床驱动器 {@code (tramp thunk flag)}。
 *
 * 标志未置位时反复以零个实参调用当前挂起计算并用结果替换它；标志置位后返回当前值。
 * 每次弹跳都从循环内发起，宿主栈深度与弹跳次数无关。
 */
public final class TrampolineDriver implements Procedure {
  public static final TrampolineDriver INSTANCE = new TrampolineDriver();

  private static final Object[] NO_ARGS = new Object[0];

  private TrampolineDriver() {}

  @Override
  public Object invoke(Object[] args) {
    if (args.length != 2) {
      throw new TailcallRuntimeException(ErrorMessages.arityMismatch("tramp", 2, args.length));
    }
    if (!(args[1] instanceof CompletionFlag flag)) {
      throw new TailcallRuntimeException(ErrorMessages.operationExpectedType("tramp", "CompletionFlag", args[1]));
    }
    return drive(args[0], flag);
  }

  @TruffleBoundary
  public static Object drive(Object initial, CompletionFlag flag) {
    Object current = initial;
    while (!flag.isSet()) {
      if (!(current instanceof Procedure thunk)) {
        throw new TailcallRuntimeException(ErrorMessages.trampolineStalled(current));
      }
      Profiler.inc(Profiler.BOUNCE);
      current = thunk.invoke(NO_ARGS);
    }
    return current;
  }

  @Override
  public String toString() {
    return "TrampolineDriver";
  }
}
