package tailcall.truffle.nodes;

import tailcall.truffle.runtime.ErrorMessages;
import tailcall.truffle.runtime.TailcallRuntimeException;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 变量读取节点，沿当前环境链查找。
 */
public final class NameNode extends TailcallExpressionNode {
  private final String name;

  public NameNode(String name) {
    this.name = name;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("name");
    Object value = Exec.env(frame).get(name);
    if (value == null) {
      throw new TailcallRuntimeException(ErrorMessages.unboundVariable(name), this);
    }
    return value;
  }

  public String getName() {
    return name;
  }
}
