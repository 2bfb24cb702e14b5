package tailcall.truffle.ast;

/**
 * 条件表达式的三种阶段变体。
 *
 * 子节点顺序固定为：测试、真分支、假分支。
 */
public sealed interface Conditional extends Expr
    permits TrivialConditional, SeriousConditional, ConvertedConditional {

  Expr test();

  Expr conseq();

  Expr alt();

  /**
   * 按源树规则分类：测试与两个分支都平凡时为 {@link TrivialConditional}，否则为 {@link SeriousConditional}。
   */
  static Conditional of(Expr test, Expr conseq, Expr alt) {
    if (Triviality.isTrivial(test) && Triviality.isTrivial(conseq) && Triviality.isTrivial(alt)) {
      return new TrivialConditional(test, conseq, alt);
    }
    return new SeriousConditional(test, conseq, alt);
  }
}
