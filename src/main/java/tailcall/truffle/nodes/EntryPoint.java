package tailcall.truffle.nodes;

import tailcall.truffle.runtime.Builtins;
import tailcall.truffle.runtime.CompletionFlag;
import tailcall.truffle.runtime.Procedure;
import tailcall.truffle.runtime.TerminalContinuationValue;
import tailcall.truffle.runtime.TrampolineDriver;
import com.oracle.truffle.api.interop.InteropLibrary;
import com.oracle.truffle.api.library.ExportLibrary;
import com.oracle.truffle.api.library.ExportMessage;

/**
 * 已编译函数对宿主的入口。
 *
 * 宿主按源语言的参数个数调用；入口在末尾追加一个持有新完成标志的最终续延，
 * 然后驱动蹦床直到标志置位。返回的函数值同样包装为入口，宿主可以继续直接调用。
 */
@ExportLibrary(InteropLibrary.class)
public final class EntryPoint implements Procedure {
  private final Closure target;

  public EntryPoint(Closure target) {
    this.target = target;
  }

  /**
   * 编译模式下交给宿主的值：闭包包装为入口，其它值原样返回。
   */
  public static Object wrap(Object value) {
    return value instanceof Closure closure ? new EntryPoint(closure) : value;
  }

  @Override
  public Object invoke(Object[] args) {
    Profiler.inc(Profiler.ENTRY);
    CompletionFlag flag = new CompletionFlag();
    Object[] full = new Object[args.length + 1];
    for (int i = 0; i < args.length; i++) {
      full[i] = Builtins.normalize(args[i]);
    }
    full[args.length] = new TerminalContinuationValue(flag);
    Object result = target.invoke(full);
    return wrap(TrampolineDriver.drive(result, flag));
  }

  @ExportMessage
  boolean isExecutable() {
    return true;
  }

  @ExportMessage
  Object execute(Object[] args) {
    return invoke(args);
  }

  @Override
  public String toString() {
    return "EntryPoint(" + target.getName() + ")";
  }
}
