package tailcall.truffle.passes;

import tailcall.truffle.InvariantViolationException;
import tailcall.truffle.MalformedExpressionException;
import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.ContinuationApplication;
import tailcall.truffle.ast.ConvertedConditional;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Literal;
import tailcall.truffle.ast.Operation;
import tailcall.truffle.ast.Program;
import tailcall.truffle.ast.SeriousConditional;
import tailcall.truffle.ast.Stage;
import tailcall.truffle.ast.TrivialConditional;
import tailcall.truffle.ast.Triviality;
import tailcall.truffle.ast.Variable;
import tailcall.truffle.ast.Walk;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * CPS 转换引擎。
 *
 * 转换后每个严肃计算都通过调用显式续延交付结果，每个平凡计算都内联传递。
 * <ul>
 *   <li>{@link #convertTrivial(Expr)}：平凡表达式结构不变，只递归进入平凡子节点；函数增加续延参数</li>
 *   <li>{@link #convert(Expr, Expr)}：严肃表达式在续延 {@code k} 下转换</li>
 *   <li>{@link #convertDefinition(Definition)}：顶层定义追加自身的续延参数</li>
 * </ul>
 */
public final class CpsConverter {
  private final FreshNames names;

  public CpsConverter(FreshNames names) {
    this.names = names;
  }

  public static boolean isTrivial(Expr expr) {
    return Triviality.isTrivial(expr);
  }

  /**
   * 转换顶层形式：定义或由定义组成的程序。
   */
  public Expr convertTopLevel(Expr expr) {
    if (expr instanceof Program program) {
      List<Expr> forms = new ArrayList<>(program.forms().size());
      for (Expr form : program.forms()) {
        forms.add(convertTopLevelForm(form));
      }
      return new Program(forms);
    }
    return convertTopLevelForm(expr);
  }

  private Expr convertTopLevelForm(Expr form) {
    if (form instanceof Definition def) {
      return convertDefinition(def);
    }
    throw new InvariantViolationException("Top-level form must be a definition before CPS conversion", form);
  }

  /**
   * 转换顶层定义：先把函数体中的自引用改名为新鲜名字，再追加续延参数并在该参数下转换函数体。
   */
  public Definition convertDefinition(Definition def) {
    if (def.hasSelfName()) {
      throw new InvariantViolationException("Definition was already CPS-converted", def);
    }
    String self = names.fresh(def.name());
    // 参数与定义同名时函数体内的名字指向参数，Renamer 在 Definition 处停止下降
    Expr body = ((Definition) Renamer.rename(def, def.name(), self)).body();
    String k = names.fresh("k");
    List<String> params = new ArrayList<>(def.params());
    params.add(k);
    return new Definition(def.name(), params, convertBody(body, new Variable(k)), self);
  }

  /**
   * 平凡表达式的转换。
   */
  public Expr convertTrivial(Expr expr) {
    rejectForeign(expr);
    if (expr instanceof Literal || expr instanceof Variable || expr instanceof ConvertedConditional) {
      return expr;
    }
    if (expr instanceof Operation op && isTrivial(op)) {
      return Walk.map(op, this::convertTrivial);
    }
    if (expr instanceof Abstraction fn) {
      String k = names.fresh("k");
      List<String> params = new ArrayList<>(fn.params());
      params.add(k);
      return new Abstraction(params, convertBody(fn.body(), new Variable(k)));
    }
    if (expr instanceof TrivialConditional cond) {
      return Walk.fold(cond, this::convertTrivial,
          kids -> new ConvertedConditional(kids.get(0), kids.get(1), kids.get(2)));
    }
    throw new InvariantViolationException("Attempt to CPS serious expression as trivial", expr);
  }

  /**
   * 严肃表达式在续延 {@code k} 下的转换。对平凡表达式则直接把转换结果交给 {@code k}。
   *
   * @param expr 待转换表达式
   * @param k 单参数函数表达式（变量或续延）
   */
  public Expr convert(Expr expr, Expr k) {
    rejectForeign(expr);
    if (isTrivial(expr)) {
      return new ContinuationApplication(k, convertTrivial(expr));
    }
    if (expr instanceof SeriousConditional cond) {
      return convertConditional(cond, k);
    }
    if (expr instanceof Application app) {
      return sequence(app.children(),
          simple -> new Application(simple.get(0), appendContinuation(simple.subList(1, simple.size()), k)));
    }
    if (expr instanceof Operation op) {
      return sequence(op.operands(), simple -> new ContinuationApplication(k, new Operation(op.op(), simple)));
    }
    if (expr instanceof Definition) {
      throw new MalformedExpressionException("Definition is only allowed at top level", expr);
    }
    if (expr instanceof Program) {
      throw new MalformedExpressionException("Program is only allowed at the root", expr);
    }
    throw new MalformedExpressionException("Unrecognized expression in CPS conversion", expr);
  }

  private Expr convertConditional(SeriousConditional cond, Expr k) {
    Expr conseq = convertBody(cond.conseq(), k);
    Expr alt = convertBody(cond.alt(), k);
    if (isTrivial(cond.test())) {
      return new ConvertedConditional(convertTrivial(cond.test()), conseq, alt);
    }
    // 严肃测试：先求值一次并绑定到新鲜变量，再分派
    String s = names.fresh("s");
    Continuation dispatch = new Continuation(s, new ConvertedConditional(new Variable(s), conseq, alt));
    return convert(cond.test(), dispatch);
  }

  private Expr convertBody(Expr body, Expr k) {
    return isTrivial(body) ? new ContinuationApplication(k, convertTrivial(body)) : convert(body, k);
  }

  /**
   * 从左到右求值子表达式：严肃子表达式先在续延中绑定到新鲜变量，
   * 平凡子表达式直接内联，最后由 {@code build} 构造最内层表达式。
   */
  private Expr sequence(List<Expr> exprs, Function<List<Expr>, Expr> build) {
    List<Expr> simple = new ArrayList<>(exprs.size());
    List<String> pendingNames = new ArrayList<>();
    List<Expr> pending = new ArrayList<>();
    for (Expr e : exprs) {
      if (isTrivial(e)) {
        simple.add(convertTrivial(e));
      } else {
        String s = names.fresh("s");
        simple.add(new Variable(s));
        pendingNames.add(s);
        pending.add(e);
      }
    }
    Expr result = build.apply(simple);
    for (int i = pending.size() - 1; i >= 0; i--) {
      result = convert(pending.get(i), new Continuation(pendingNames.get(i), result));
    }
    return result;
  }

  private static List<Expr> appendContinuation(List<Expr> operands, Expr k) {
    List<Expr> out = new ArrayList<>(operands.size() + 1);
    out.addAll(operands);
    out.add(k);
    return out;
  }

  /**
   * CPS 阶段的输入只能是源树节点。
   */
  private static void rejectForeign(Expr expr) {
    if (expr instanceof Continuation || expr instanceof ContinuationApplication) {
      throw new MalformedExpressionException("Continuation node in CPS input", expr);
    }
    if (expr.stage() == Stage.TARGET) {
      throw new MalformedExpressionException("Target-only node in CPS input", expr);
    }
  }
}
