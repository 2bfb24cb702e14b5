package tailcall.truffle;

import tailcall.truffle.ast.Expr;
import tailcall.truffle.runtime.ErrorMessages;

/**
 * 表达式头部在当前阶段无法识别。致命错误，编译立即中止，不产生任何输出。
 */
public class MalformedExpressionException extends TailcallException {

  private static final long serialVersionUID = 1L;

  private final String nodeDescription;
  private final transient Expr node;

  public MalformedExpressionException(String message, String nodeDescription) {
    this(message, nodeDescription, null);
  }

  public MalformedExpressionException(String message, Expr node) {
    this(message, String.valueOf(node), node);
  }

  public MalformedExpressionException(String message, String nodeDescription, Expr node) {
    super(ErrorMessages.malformedExpression(message, nodeDescription));
    this.nodeDescription = nodeDescription;
    this.node = node;
  }

  /** 出错节点的文本描述（源 JSON 片段或节点的 toString） */
  public String getNodeDescription() {
    return nodeDescription;
  }

  /** 出错节点；错误在节点构造之前发现时为 null */
  public Expr getNode() {
    return node;
  }
}
