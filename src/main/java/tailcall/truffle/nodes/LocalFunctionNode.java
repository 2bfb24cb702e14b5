package tailcall.truffle.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 局部函数：名字只在函数自身与作用域主体中可见。
 */
public final class LocalFunctionNode extends TailcallExpressionNode {
  private final String name;
  @Child private LambdaNode lambda;
  @Child private TailcallExpressionNode scopeNode;

  public LocalFunctionNode(String name, LambdaNode lambda, TailcallExpressionNode scopeNode) {
    this.name = name;
    this.lambda = lambda;
    this.scopeNode = scopeNode;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("letfn");
    Env outer = Exec.env(frame);
    Env inner = outer.createChild();
    Exec.setEnv(frame, inner);
    try {
      // 闭包捕获 inner，函数体内可以看到自己的名字
      inner.define(name, lambda.executeGeneric(frame));
      return scopeNode.executeGeneric(frame);
    } finally {
      Exec.setEnv(frame, outer);
    }
  }
}
