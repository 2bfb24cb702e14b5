package tailcall.truffle.passes;

import tailcall.truffle.ast.Names;

/**
 * 新鲜名字生成器。
 *
 * 生成形如 {@code base$N} 的名字，{@code N} 单调递增。用户标识符中禁止出现 {@code $}，
 * 因此生成名永远不会与源程序中的名字冲突。每次独立编译使用一个实例，
 * 同一实例不能在并发编译之间共享。
 */
public final class FreshNames {
  private int counter;

  public FreshNames() {
    this(0);
  }

  public FreshNames(int start) {
    this.counter = start;
  }

  /**
   * 生成一个新鲜名字。若 {@code base} 本身是生成名，则先去掉其编号后缀。
   */
  public String fresh(String base) {
    String stem = base;
    int idx = base.indexOf(Names.GENERATED_SEPARATOR);
    if (idx > 0) {
      stem = base.substring(0, idx);
    }
    return stem + Names.GENERATED_SEPARATOR + (++counter);
  }

  /** 已生成的名字数量 */
  public int issued() {
    return counter;
  }

  public void reset() {
    counter = 0;
  }
}
