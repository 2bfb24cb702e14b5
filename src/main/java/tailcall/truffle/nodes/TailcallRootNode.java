package tailcall.truffle.nodes;

import tailcall.truffle.TailcallContext;
import tailcall.truffle.TailcallLanguage;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.RootNode;

/**
 * 程序入口 RootNode。
 *
 * 在新的全局环境中求值整棵树。编译模式下结果若为函数，则包装为 {@link EntryPoint}，
 * 宿主调用时会自动追加最终续延并驱动蹦床。
 */
public final class TailcallRootNode extends RootNode {
  @Child private TailcallExpressionNode body;
  private final boolean compiled;

  public TailcallRootNode(TailcallLanguage language, TailcallExpressionNode body, boolean compiled) {
    super(language, Exec.newDescriptor());
    this.body = body;
    this.compiled = compiled;
  }

  @Override
  public Object execute(VirtualFrame frame) {
    Exec.setEnv(frame, new Env());
    Object result = body.executeGeneric(frame);
    if (TailcallContext.get(this).getConfig().isDebugEnabled()) {
      System.err.println("DEBUG: program (" + (compiled ? "compiled" : "direct") + ") returned=" + result);
    }
    return compiled ? EntryPoint.wrap(result) : result;
  }

  @Override
  public String getName() {
    return compiled ? "tailcall-program" : "tailcall-program-direct";
  }
}
