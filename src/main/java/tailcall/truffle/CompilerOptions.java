package tailcall.truffle;

import tailcall.truffle.passes.FreshNames;

/**
 * 单次编译的设置。
 *
 * {@code freshNames} 为 null 时每次编译新建一个计数器；测试可以注入自己的实例以获得确定的名字。
 */
public final class CompilerOptions {
  private final FreshNames freshNames;
  private final String trampolineBase;
  private final String dispatcherBase;
  private final String entryBase;

  public CompilerOptions(FreshNames freshNames, String trampolineBase, String dispatcherBase, String entryBase) {
    this.freshNames = freshNames;
    this.trampolineBase = trampolineBase;
    this.dispatcherBase = dispatcherBase;
    this.entryBase = entryBase;
  }

  public static CompilerOptions defaults() {
    return new CompilerOptions(null, "tramp", "apply-k", "entry");
  }

  public CompilerOptions withFreshNames(FreshNames names) {
    return new CompilerOptions(names, trampolineBase, dispatcherBase, entryBase);
  }

  /** 本次编译使用的名字源 */
  public FreshNames newFreshNames() {
    return freshNames != null ? freshNames : new FreshNames();
  }

  public String getTrampolineBase() {
    return trampolineBase;
  }

  public String getDispatcherBase() {
    return dispatcherBase;
  }

  public String getEntryBase() {
    return entryBase;
  }
}
