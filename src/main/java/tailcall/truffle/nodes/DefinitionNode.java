package tailcall.truffle.nodes;

import tailcall.truffle.runtime.TailcallConfig;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 顶层定义：在当前环境中把名字绑定到闭包。闭包捕获的正是这个环境，因此定义可以递归引用自身，
 * 也可以引用同一程序中稍后定义的名字。
 */
public final class DefinitionNode extends TailcallExpressionNode {
  private final String name;
  @Child private LambdaNode lambda;

  public DefinitionNode(String name, LambdaNode lambda) {
    this.name = name;
    this.lambda = lambda;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("define");
    Closure closure = lambda.executeGeneric(frame);
    Exec.env(frame).define(name, closure);
    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: defn " + name);
    }
    return closure;
  }
}
