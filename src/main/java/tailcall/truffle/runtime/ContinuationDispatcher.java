package tailcall.truffle.runtime;

import tailcall.truffle.nodes.Profiler;

/**
 * 共享的续延分派器 {@code (apply-k v k)}。
 *
 * 最终续延：置位其标志并返回 {@code v}。其它续延：返回一个挂起计算，
 * 由蹦床驱动器在下一次弹跳时调用 {@code k(v)}，标志保持未置位。
 */
public final class ContinuationDispatcher implements Procedure {
  public static final ContinuationDispatcher INSTANCE = new ContinuationDispatcher();

  private ContinuationDispatcher() {}

  @Override
  public Object invoke(Object[] args) {
    if (args.length != 2) {
      throw new TailcallRuntimeException(ErrorMessages.arityMismatch("apply-k", 2, args.length));
    }
    return dispatch(args[0], args[1]);
  }

  public static Object dispatch(Object value, Object k) {
    Profiler.inc(Profiler.DISPATCH);
    if (k instanceof TerminalContinuationValue terminal) {
      terminal.getFlag().set();
      return value;
    }
    if (k instanceof Procedure p) {
      return new Suspension(p, value);
    }
    throw new TailcallRuntimeException(ErrorMessages.notAFunction(k));
  }

  @Override
  public String toString() {
    return "ContinuationDispatcher";
  }
}
