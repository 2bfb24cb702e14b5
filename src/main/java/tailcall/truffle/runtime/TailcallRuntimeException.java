package tailcall.truffle.runtime;

import com.oracle.truffle.api.exception.AbstractTruffleException;
import com.oracle.truffle.api.nodes.Node;

/**
 * 用户程序的运行期错误（除零、调用非函数、参数个数不匹配、变量未绑定）。
 *
 * 作为客体异常穿过蹦床循环原样传播，Polyglot 调用方看到的是 {@code PolyglotException}。
 */
public final class TailcallRuntimeException extends AbstractTruffleException {
  private static final long serialVersionUID = 1L;

  public TailcallRuntimeException(String message) {
    super(message);
  }

  public TailcallRuntimeException(String message, Node location) {
    super(message, location);
  }
}
