package tailcall.truffle.ast;

/**
 * 平凡/严肃分类。对所有节点类型都有定义，从不抛出异常。
 *
 * 平凡表达式是值或可以安全复制的表达式，不需要传递续延；
 * 严肃表达式需要求值，必须显式传递续延。
 */
public final class Triviality {

  private Triviality() {}

  public static boolean isTrivial(Expr expr) {
    if (expr instanceof Literal || expr instanceof Variable) return true;
    if (expr instanceof Abstraction || expr instanceof Continuation) return true;
    if (expr instanceof TrivialConditional || expr instanceof ConvertedConditional) return true;
    if (expr instanceof Intrinsic || expr instanceof TerminalContinuation) return true;
    if (expr instanceof Operation op) {
      for (Expr operand : op.operands()) {
        if (!isTrivial(operand)) return false;
      }
      return true;
    }
    // SeriousConditional, Application, ContinuationApplication, Definition, Program,
    // Let, LocalFunction, NewFlag
    return false;
  }
}
