package tailcall.truffle.nodes;

import tailcall.truffle.MalformedExpressionException;
import tailcall.truffle.TailcallLanguage;
import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Conditional;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.ContinuationApplication;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Intrinsic;
import tailcall.truffle.ast.Let;
import tailcall.truffle.ast.Literal;
import tailcall.truffle.ast.LocalFunction;
import tailcall.truffle.ast.NewFlag;
import tailcall.truffle.ast.Operation;
import tailcall.truffle.ast.Program;
import tailcall.truffle.ast.TerminalContinuation;
import tailcall.truffle.ast.Variable;
import java.util.List;

/**
 * 把任意阶段的表达式树构造为 Truffle 节点树。
 *
 * 每个函数体（匿名函数、定义、局部函数、续延）都有自己的 {@link LambdaRootNode}。
 */
public final class NodeBuilder {
  private final TailcallLanguage language;
  private int anonymous;

  public NodeBuilder(TailcallLanguage language) {
    this.language = language;
  }

  public TailcallExpressionNode build(Expr expr) {
    if (expr instanceof Literal lit) {
      return LiteralNode.create(lit);
    }
    if (expr instanceof Variable v) {
      return new NameNode(v.name());
    }
    if (expr instanceof Operation op) {
      return new OperationNode(op.op(), buildAll(op.operands()));
    }
    if (expr instanceof Conditional cond) {
      return IfNode.create(build(cond.test()), build(cond.conseq()), build(cond.alt()));
    }
    if (expr instanceof Abstraction fn) {
      return lambda("fn#" + (++anonymous), fn.params(), fn.body());
    }
    if (expr instanceof Continuation k) {
      return lambda("k#" + (++anonymous), List.of(k.param()), k.body());
    }
    if (expr instanceof Definition def) {
      return new DefinitionNode(def.name(), lambda(def.name(), def.params(), def.body()));
    }
    if (expr instanceof Application app) {
      return new CallNode(build(app.operator()), buildAll(app.operands()));
    }
    if (expr instanceof ContinuationApplication ka) {
      return new CallNode(build(ka.continuation()), new TailcallExpressionNode[] {build(ka.argument())});
    }
    if (expr instanceof Program program) {
      return new ProgramNode(buildAll(program.forms()));
    }
    if (expr instanceof Let let) {
      return new LetNode(let.name(), build(let.value()), build(let.body()));
    }
    if (expr instanceof LocalFunction fn) {
      return new LocalFunctionNode(fn.name(), lambda(fn.name(), fn.params(), fn.functionBody()), build(fn.scope()));
    }
    if (expr instanceof NewFlag) {
      return new NewFlagNode();
    }
    if (expr instanceof TerminalContinuation t) {
      return new TerminalNode(build(t.flag()));
    }
    if (expr instanceof Intrinsic in) {
      return new IntrinsicNode(in.kind());
    }
    throw new MalformedExpressionException("Cannot build node", expr);
  }

  private TailcallExpressionNode[] buildAll(List<Expr> exprs) {
    TailcallExpressionNode[] nodes = new TailcallExpressionNode[exprs.size()];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = build(exprs.get(i));
    }
    return nodes;
  }

  private LambdaNode lambda(String name, List<String> params, Expr body) {
    LambdaRootNode root = new LambdaRootNode(language, name, params.toArray(new String[0]), build(body));
    return new LambdaNode(name, params, root.getCallTarget());
  }
}
