package tailcall.truffle.nodes;

import tailcall.truffle.runtime.Builtins;
import tailcall.truffle.runtime.TailcallRuntimeException;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;

/**
 * 平凡运算节点：按顺序求值操作数后交给 {@link Builtins}。
 */
public final class OperationNode extends TailcallExpressionNode {
  private final String op;
  @CompilationFinal private final Builtins.BuiltinFunction impl;
  @Children private final TailcallExpressionNode[] operands;

  public OperationNode(String op, TailcallExpressionNode[] operands) {
    this.op = op;
    this.impl = Builtins.lookup(op);
    this.operands = operands;
  }

  @Override
  @ExplodeLoop
  public Object executeGeneric(VirtualFrame frame) {
    Profiler.inc("op");
    Object[] values = new Object[operands.length];
    for (int i = 0; i < operands.length; i++) {
      values[i] = operands[i].executeGeneric(frame);
    }
    try {
      return impl.call(values);
    } catch (Builtins.BuiltinException e) {
      throw new TailcallRuntimeException(e.getMessage(), this);
    }
  }

  public String getOp() {
    return op;
  }
}
