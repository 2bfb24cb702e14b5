package tailcall.truffle.nodes;

import com.oracle.truffle.api.CallTarget;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import java.util.List;

/**
 * 在运行时创建闭包，捕获当前环境。
 */
public final class LambdaNode extends TailcallExpressionNode {
  @CompilationFinal private final String name;
  @CompilationFinal private final List<String> params;
  @CompilationFinal private final CallTarget callTarget;

  public LambdaNode(String name, List<String> params, CallTarget callTarget) {
    this.name = name;
    this.params = params;
    this.callTarget = callTarget;
  }

  @Override
  public Closure executeGeneric(VirtualFrame frame) {
    Profiler.inc("closure_create");
    return new Closure(name, params, Exec.env(frame), callTarget);
  }

  @Override
  public String toString() {
    return "LambdaNode(" + name + ", params=" + params + ")";
  }
}
