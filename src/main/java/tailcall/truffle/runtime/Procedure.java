package tailcall.truffle.runtime;

import com.oracle.truffle.api.interop.TruffleObject;

/**
 * 可被调用节点直接调用的运行时值。
 */
public interface Procedure extends TruffleObject {

  Object invoke(Object[] args);
}
