package tailcall.truffle.nodes;

import tailcall.truffle.ast.Intrinsic;
import tailcall.truffle.runtime.ContinuationDispatcher;
import tailcall.truffle.runtime.Procedure;
import tailcall.truffle.runtime.TrampolineDriver;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 返回共享的运行时过程。
 */
public final class IntrinsicNode extends TailcallExpressionNode {
  @CompilationFinal private final Procedure procedure;

  public IntrinsicNode(Intrinsic.Kind kind) {
    this.procedure = kind == Intrinsic.Kind.TRAMPOLINE ? TrampolineDriver.INSTANCE : ContinuationDispatcher.INSTANCE;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    return procedure;
  }
}
