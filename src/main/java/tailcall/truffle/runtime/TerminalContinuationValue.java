package tailcall.truffle.runtime;

/**
 * 最终续延：值到达这里就是该次激活的结果，同时置位对应的完成标志。
 */
public final class TerminalContinuationValue implements Procedure {
  private final CompletionFlag flag;

  public TerminalContinuationValue(CompletionFlag flag) {
    this.flag = flag;
  }

  public CompletionFlag getFlag() {
    return flag;
  }

  /**
   * 直接调用时与分派器的行为一致。
   */
  @Override
  public Object invoke(Object[] args) {
    if (args.length != 1) {
      throw new TailcallRuntimeException(ErrorMessages.arityMismatch("terminal continuation", 1, args.length));
    }
    flag.set();
    return args[0];
  }

  @Override
  public String toString() {
    return "TerminalContinuation(" + flag + ")";
  }
}
