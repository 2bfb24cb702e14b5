package tailcall.truffle.nodes;

import tailcall.truffle.types.TailcallTypes;
import com.oracle.truffle.api.dsl.TypeSystemReference;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.Node;
import com.oracle.truffle.api.nodes.UnexpectedResultException;

/**
 * 表达式节点的抽象基类
 *
 * 子类可以只实现 {@link #executeGeneric(VirtualFrame)}，也可以用 @Specialization 提供类型特化实现。
 */
@TypeSystemReference(TailcallTypes.class)
public abstract class TailcallExpressionNode extends Node {

  public abstract Object executeGeneric(VirtualFrame frame);

  public long executeLong(VirtualFrame frame) throws UnexpectedResultException {
    Object result = executeGeneric(frame);
    if (result instanceof Long) {
      return (long) result;
    }
    throw new UnexpectedResultException(result);
  }

  public double executeDouble(VirtualFrame frame) throws UnexpectedResultException {
    Object result = executeGeneric(frame);
    if (result instanceof Double) {
      return (double) result;
    }
    throw new UnexpectedResultException(result);
  }

  public boolean executeBoolean(VirtualFrame frame) throws UnexpectedResultException {
    Object result = executeGeneric(frame);
    if (result instanceof Boolean) {
      return (boolean) result;
    }
    throw new UnexpectedResultException(result);
  }
}
