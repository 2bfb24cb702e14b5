package tailcall.truffle.runtime;

import tailcall.truffle.nodes.Profiler;

/**
 * 挂起的续延调用：被强制时以 {@code value} 调用 {@code continuation}。
 */
public final class Suspension implements Procedure {
  private final Procedure continuation;
  private final Object value;

  public Suspension(Procedure continuation, Object value) {
    this.continuation = continuation;
    this.value = value;
  }

  @Override
  public Object invoke(Object[] args) {
    if (args.length != 0) {
      throw new TailcallRuntimeException(ErrorMessages.arityMismatch("suspension", 0, args.length));
    }
    Profiler.inc(Profiler.RESUME);
    return continuation.invoke(new Object[] {value});
  }
}
