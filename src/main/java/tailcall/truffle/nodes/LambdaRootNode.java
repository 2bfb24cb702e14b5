package tailcall.truffle.nodes;

import tailcall.truffle.TailcallLanguage;
import tailcall.truffle.runtime.ErrorMessages;
import tailcall.truffle.runtime.TailcallConfig;
import tailcall.truffle.runtime.TailcallRuntimeException;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import com.oracle.truffle.api.nodes.RootNode;

/**
 * 函数的 RootNode
 *
 * 每个函数都有独立的 RootNode 和 CallTarget。实参 0 是闭包捕获的环境，
 * 其余实参在该环境的子环境中绑定到形参。
 */
public final class LambdaRootNode extends RootNode {
  @CompilationFinal private final String name;
  @CompilationFinal(dimensions = 1) private final String[] params;
  @Child private TailcallExpressionNode bodyNode;

  public LambdaRootNode(TailcallLanguage language, String name, String[] params, TailcallExpressionNode bodyNode) {
    super(language, Exec.newDescriptor());
    this.name = name;
    this.params = params;
    this.bodyNode = bodyNode;
  }

  @Override
  public Object execute(VirtualFrame frame) {
    Profiler.inc("lambda_execute");
    Object[] args = frame.getArguments();
    if (args.length - 1 != params.length) {
      throw new TailcallRuntimeException(ErrorMessages.arityMismatch(name, params.length, args.length - 1), this);
    }
    Env callEnv = ((Env) args[0]).createChild();
    bindParameters(callEnv, args);
    Exec.setEnv(frame, callEnv);
    Object result = bodyNode.executeGeneric(frame);
    if (TailcallConfig.DEBUG) {
      System.err.println("DEBUG: " + name + " returned=" + result);
    }
    return result;
  }

  @ExplodeLoop
  private void bindParameters(Env callEnv, Object[] args) {
    for (int i = 0; i < params.length; i++) {
      callEnv.define(params[i], args[i + 1]);
    }
  }

  @Override
  public String getName() {
    return name;
  }
}
