package tailcall.truffle.nodes;

import tailcall.truffle.runtime.CompletionFlag;
import tailcall.truffle.runtime.ErrorMessages;
import tailcall.truffle.runtime.TailcallRuntimeException;
import tailcall.truffle.runtime.TerminalContinuationValue;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 以给定完成标志构造最终续延。
 */
public final class TerminalNode extends TailcallExpressionNode {
  @Child private TailcallExpressionNode flagNode;

  public TerminalNode(TailcallExpressionNode flagNode) {
    this.flagNode = flagNode;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Object flag = flagNode.executeGeneric(frame);
    if (flag instanceof CompletionFlag f) {
      return new TerminalContinuationValue(f);
    }
    throw new TailcallRuntimeException(ErrorMessages.operationExpectedType("terminal", "CompletionFlag", flag), this);
  }
}
