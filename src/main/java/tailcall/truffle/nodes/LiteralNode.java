package tailcall.truffle.nodes;

import tailcall.truffle.MalformedExpressionException;
import tailcall.truffle.ast.Literal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 字面量节点。
 *
 * 源语言只有三种字面量：整数（{@code long}）、小数（{@code double}）与布尔值，
 * 每种对应一个节点，类型化的 execute 方法直接返回未装箱的值。
 */
public abstract class LiteralNode extends TailcallExpressionNode {

  /**
   * 为字面量创建节点。{@link Literal} 已经把数值规范化为 Long 或 Double。
   *
   * @throws MalformedExpressionException 值不属于三种字面量之一
   */
  public static LiteralNode create(Literal literal) {
    Object value = literal.value();
    if (value instanceof Long l) {
      return new LongLiteral(l);
    }
    if (value instanceof Double d) {
      return new DoubleLiteral(d);
    }
    if (value instanceof Boolean b) {
      return new BooleanLiteral(b);
    }
    throw new MalformedExpressionException("Literal must be a boolean or a number", literal);
  }

  static final class LongLiteral extends LiteralNode {
    private final long value;

    LongLiteral(long value) {
      this.value = value;
    }

    @Override
    public long executeLong(VirtualFrame frame) {
      Profiler.inc("literal");
      return value;
    }

    @Override
    public double executeDouble(VirtualFrame frame) {
      Profiler.inc("literal");
      return value;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      Profiler.inc("literal");
      return value;
    }
  }

  static final class DoubleLiteral extends LiteralNode {
    private final double value;

    DoubleLiteral(double value) {
      this.value = value;
    }

    @Override
    public double executeDouble(VirtualFrame frame) {
      Profiler.inc("literal");
      return value;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      Profiler.inc("literal");
      return value;
    }
  }

  static final class BooleanLiteral extends LiteralNode {
    private final boolean value;

    BooleanLiteral(boolean value) {
      this.value = value;
    }

    @Override
    public boolean executeBoolean(VirtualFrame frame) {
      Profiler.inc("literal");
      return value;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      Profiler.inc("literal");
      return value;
    }
  }
}
