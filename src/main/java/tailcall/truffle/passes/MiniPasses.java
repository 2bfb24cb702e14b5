package tailcall.truffle.passes;

import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Intrinsic;
import tailcall.truffle.ast.Let;
import tailcall.truffle.ast.NewFlag;
import tailcall.truffle.ast.TerminalContinuation;
import tailcall.truffle.ast.Variable;
import java.util.List;

/**
 * 蹦床插入前后的小变换。
 */
public final class MiniPasses {

  private MiniPasses() {}

  /**
   * 在整个程序外绑定共享的蹦床驱动器与续延分派器。
   */
  public static Expr bindIntrinsics(Expr program, String tramp, String applyK) {
    return new Let(tramp, new Intrinsic(Intrinsic.Kind.TRAMPOLINE),
        new Let(applyK, new Intrinsic(Intrinsic.Kind.APPLY_CONTINUATION), program));
  }

  /**
   * 把顶层表达式包装成零参数匿名定义。
   */
  public static Definition wrapEntry(String entryName, Expr expr) {
    return new Definition(entryName, List.of(), expr);
  }

  /**
   * 以新的最终续延调用入口定义，使程序求值为该表达式的值。
   */
  public static Expr invokeEntry(String entryName) {
    return new Application(new Variable(entryName), List.of(new TerminalContinuation(new NewFlag())));
  }
}
