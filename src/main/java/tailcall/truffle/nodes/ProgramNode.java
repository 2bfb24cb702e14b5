package tailcall.truffle.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;

/**
 * 按顺序求值顶层形式，结果为最后一个形式的值。
 */
public final class ProgramNode extends TailcallExpressionNode {
  @Children private final TailcallExpressionNode[] forms;

  public ProgramNode(TailcallExpressionNode[] forms) {
    this.forms = forms;
  }

  @Override
  @ExplodeLoop
  public Object executeGeneric(VirtualFrame frame) {
    Object result = null;
    for (TailcallExpressionNode form : forms) {
      result = form.executeGeneric(frame);
    }
    return result;
  }
}
