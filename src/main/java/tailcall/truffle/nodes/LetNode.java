package tailcall.truffle.nodes;

import tailcall.truffle.runtime.TailcallConfig;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 词法绑定：在子环境中绑定名字后求值主体，结束时恢复原环境。
 */
public final class LetNode extends TailcallExpressionNode {
  private final String name;
  @Child private TailcallExpressionNode valueNode;
  @Child private TailcallExpressionNode bodyNode;

  public LetNode(String name, TailcallExpressionNode valueNode, TailcallExpressionNode bodyNode) {
    this.name = name;
    this.valueNode = valueNode;
    this.bodyNode = bodyNode;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("let");
    Object value = valueNode.executeGeneric(frame);
    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: let " + name + "=" + value);
    }
    Env outer = Exec.env(frame);
    Env inner = outer.createChild();
    inner.define(name, value);
    Exec.setEnv(frame, inner);
    try {
      return bodyNode.executeGeneric(frame);
    } finally {
      Exec.setEnv(frame, outer);
    }
  }

  public String getName() {
    return name;
  }
}
