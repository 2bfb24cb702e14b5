package tailcall.truffle.emit;

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
 * 把任意阶段的表达式树渲染为带括号的前缀形式源码。
 *
 * <pre>
 * (defn f [n k] (fn [] (if (zero? n) (apply-k$2 0 k) (f$3 (dec n) k))))
 * </pre>
 */
public final class SourceEmitter {

  private SourceEmitter() {}

  public static String emit(Expr expr) {
    StringBuilder sb = new StringBuilder();
    emit(expr, sb);
    return sb.toString();
  }

  private static void emit(Expr expr, StringBuilder sb) {
    if (expr instanceof Literal lit) {
      sb.append(lit.value());
    } else if (expr instanceof Variable v) {
      sb.append(v.name());
    } else if (expr instanceof Operation op) {
      list(sb, op.op(), op.operands());
    } else if (expr instanceof Conditional cond) {
      list(sb, "if", List.of(cond.test(), cond.conseq(), cond.alt()));
    } else if (expr instanceof Abstraction fn) {
      sb.append("(fn ");
      params(sb, fn.params());
      sb.append(' ');
      emit(fn.body(), sb);
      sb.append(')');
    } else if (expr instanceof Continuation k) {
      sb.append("(fn ");
      params(sb, List.of(k.param()));
      sb.append(' ');
      emit(k.body(), sb);
      sb.append(')');
    } else if (expr instanceof Definition def) {
      sb.append("(defn ").append(def.name()).append(' ');
      params(sb, def.params());
      sb.append(' ');
      emit(def.body(), sb);
      sb.append(')');
    } else if (expr instanceof ContinuationApplication ka) {
      sb.append('(');
      emit(ka.continuation(), sb);
      sb.append(' ');
      emit(ka.argument(), sb);
      sb.append(')');
    } else if (expr instanceof Application app) {
      sb.append('(');
      emit(app.operator(), sb);
      for (Expr operand : app.operands()) {
        sb.append(' ');
        emit(operand, sb);
      }
      sb.append(')');
    } else if (expr instanceof Program program) {
      list(sb, "do", program.forms());
    } else if (expr instanceof Let let) {
      sb.append("(let [").append(let.name()).append(' ');
      emit(let.value(), sb);
      sb.append("] ");
      emit(let.body(), sb);
      sb.append(')');
    } else if (expr instanceof LocalFunction fn) {
      sb.append("(letfn [(").append(fn.name()).append(' ');
      params(sb, fn.params());
      sb.append(' ');
      emit(fn.functionBody(), sb);
      sb.append(")] ");
      emit(fn.scope(), sb);
      sb.append(')');
    } else if (expr instanceof NewFlag) {
      sb.append("(new-flag)");
    } else if (expr instanceof TerminalContinuation t) {
      list(sb, "terminal", List.of(t.flag()));
    } else if (expr instanceof Intrinsic in) {
      sb.append(in.kind() == Intrinsic.Kind.TRAMPOLINE ? "(intrinsic trampoline)" : "(intrinsic apply-continuation)");
    }
  }

  private static void list(StringBuilder sb, String head, List<Expr> items) {
    sb.append('(').append(head);
    for (Expr item : items) {
      sb.append(' ');
      emit(item, sb);
    }
    sb.append(')');
  }

  private static void params(StringBuilder sb, List<String> params) {
    sb.append('[').append(String.join(" ", params)).append(']');
  }
}
