package tailcall.truffle.nodes;

import tailcall.truffle.runtime.ErrorMessages;
import tailcall.truffle.runtime.Procedure;
import tailcall.truffle.runtime.TailcallConfig;
import tailcall.truffle.runtime.TailcallRuntimeException;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import com.oracle.truffle.api.nodes.IndirectCallNode;

/**
 * 函数调用节点
 *
 * 先求值调用目标，再从左到右求值实参。闭包经 {@link IndirectCallNode} 调用其 CallTarget，
 * 其它运行时过程（蹦床驱动器、续延分派器、最终续延、挂起计算）直接调用。
 */
public final class CallNode extends TailcallExpressionNode {
  @Child private TailcallExpressionNode target;
  @Children private final TailcallExpressionNode[] args;
  @Child private IndirectCallNode callNode = IndirectCallNode.create();

  public CallNode(TailcallExpressionNode target, TailcallExpressionNode[] args) {
    this.target = target;
    this.args = args;
  }

  @Override
  @ExplodeLoop
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("call");
    Object fn = target.executeGeneric(frame);
    Object[] av = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      av[i] = args[i].executeGeneric(frame);
    }
    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: call target=" + fn + " args=" + java.util.Arrays.toString(av));
    }
    if (fn instanceof Closure closure) {
      return callNode.call(closure.getCallTarget(), closure.pack(av));
    }
    if (fn instanceof Procedure procedure) {
      return procedure.invoke(av);
    }
    throw new TailcallRuntimeException(ErrorMessages.notAFunction(fn), this);
  }
}
