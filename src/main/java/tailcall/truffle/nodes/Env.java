package tailcall.truffle.nodes;

import java.util.HashMap;
import java.util.Map;

/**
 * 词法环境链。闭包捕获创建时的环境，调用时在其上创建子环境绑定参数。
 */
public final class Env {
  private final Env parent;
  private final Map<String,Object> vars = new HashMap<>();

  public Env() {
    this(null);
  }

  private Env(Env parent) {
    this.parent = parent;
  }

  /**
   * 创建子环境，读取可向父环境回溯，定义仅影响当前作用域。
   */
  public Env createChild() { return new Env(this); }

  public Object get(String name) {
    for (Env e = this; e != null; e = e.parent) {
      Object v = e.vars.get(name);
      if (v != null) {
        return v;
      }
    }
    return null;
  }

  /**
   * 在当前作用域定义名字，遮蔽外层同名绑定。
   */
  public void define(String name, Object v) {
    vars.put(name, v);
  }

  public boolean contains(String name) {
    return get(name) != null;
  }
}
