package tailcall.truffle.nodes;

import tailcall.truffle.runtime.TailcallConfig;
import com.oracle.truffle.api.dsl.NodeChild;
import com.oracle.truffle.api.dsl.Specialization;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 条件分支节点 - 针对布尔条件特化，并提供通用回退（只有 false 为假）。
 */
@NodeChild(value = "condNode", type = TailcallExpressionNode.class)
public abstract class IfNode extends TailcallExpressionNode {
  @Child private TailcallExpressionNode thenNode;
  @Child private TailcallExpressionNode elseNode;

  protected IfNode(TailcallExpressionNode thenNode, TailcallExpressionNode elseNode) {
    this.thenNode = thenNode;
    this.elseNode = elseNode;
  }

  public static IfNode create(TailcallExpressionNode cond, TailcallExpressionNode thenNode, TailcallExpressionNode elseNode) {
    return IfNodeGen.create(thenNode, elseNode, cond);
  }

  @Specialization
  protected Object doBooleanCond(VirtualFrame frame, boolean condValue) {
    Profiler.inc("if");
    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: if condition=" + condValue);
    }
    return condValue ? thenNode.executeGeneric(frame) : elseNode.executeGeneric(frame);
  }

  @Specialization(replaces = "doBooleanCond")
  protected Object doGenericCond(VirtualFrame frame, Object condValue) {
    Profiler.inc("if");
    boolean boolValue = Exec.toBool(condValue);
    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: if condition=" + condValue + " => " + boolValue);
    }
    return boolValue ? thenNode.executeGeneric(frame) : elseNode.executeGeneric(frame);
  }
}
