package tailcall.truffle.nodes;

import tailcall.truffle.runtime.Builtins;
import com.oracle.truffle.api.frame.FrameDescriptor;
import com.oracle.truffle.api.frame.FrameSlotKind;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 帧与真值的辅助方法。每个帧只有一个槽位，保存当前词法环境。
 */
public final class Exec {
  public static final int ENV_SLOT = 0;

  private Exec() {}

  public static FrameDescriptor newDescriptor() {
    FrameDescriptor.Builder builder = FrameDescriptor.newBuilder(1);
    builder.addSlot(FrameSlotKind.Object, "env", null);
    return builder.build();
  }

  public static Env env(VirtualFrame frame) {
    return (Env) frame.getObject(ENV_SLOT);
  }

  public static void setEnv(VirtualFrame frame, Env env) {
    frame.setObject(ENV_SLOT, env);
  }

  public static boolean toBool(Object o) {
    return Builtins.isTruthy(o);
  }
}
