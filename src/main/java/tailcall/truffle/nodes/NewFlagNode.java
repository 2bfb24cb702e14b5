package tailcall.truffle.nodes;

import tailcall.truffle.runtime.CompletionFlag;
import com.oracle.truffle.api.frame.VirtualFrame;

public final class NewFlagNode extends TailcallExpressionNode {

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("flag");
    return new CompletionFlag();
  }
}
