package tailcall.truffle.runtime;

import com.oracle.truffle.api.interop.TruffleObject;

/**
 * 一次激活的完成标志。只会从未置位变为置位，不会复位。
 */
public final class CompletionFlag implements TruffleObject {
  private boolean set;

  public boolean isSet() {
    return set;
  }

  public void set() {
    set = true;
  }

  @Override
  public String toString() {
    return "CompletionFlag(" + set + ")";
  }
}
