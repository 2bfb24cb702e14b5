package tailcall.truffle.ast;

import tailcall.truffle.InvariantViolationException;
import java.util.List;

/**
 * 表达式树的封闭节点集合。
 *
 * 所有节点都是不可变值：每个节点独占其子节点，变换阶段只会基于变换后的子节点构造新节点，
 * 从不修改输入树。子节点顺序固定，由 {@link #children()} 给出，{@link #withChildren(List)}
 * 按相同顺序重建同类节点；{@link Walk} 基于这两个方法实现统一的递归下降。
 */
public sealed interface Expr
    permits Literal, Variable, Operation, Conditional, Abstraction, Definition, Continuation,
        ContinuationApplication, Application, Program, Let, LocalFunction, NewFlag,
        TerminalContinuation, Intrinsic {

  /** 产生该节点的变换阶段 */
  Stage stage();

  /** 按固定位置顺序返回子节点（不可变列表） */
  List<Expr> children();

  /**
   * 用同样数量、同样顺序的子节点重建同类节点。
   *
   * @param children 变换后的子节点
   * @return 新节点；子节点未变化时实现可以返回自身
   */
  Expr withChildren(List<Expr> children);

  /**
   * 校验重建时传入的子节点数量。
   */
  static void requireArity(Expr node, List<Expr> children, int expected) {
    if (children.size() != expected) {
      throw new InvariantViolationException(
          "Cannot rebuild " + node.getClass().getSimpleName() + " from " + children.size()
              + " children (expected " + expected + ")", node);
    }
  }
}
