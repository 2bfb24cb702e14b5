package tailcall.truffle;

/**
 * 编译器运行期异常的公共基类。
 */
public class TailcallException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TailcallException(String message) {
    super(message);
  }

  public TailcallException(String message, Throwable cause) {
    super(message, cause);
  }
}
