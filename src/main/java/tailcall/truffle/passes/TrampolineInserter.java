package tailcall.truffle.passes;

import tailcall.truffle.InvariantViolationException;
import tailcall.truffle.ast.Application;
import tailcall.truffle.ast.Definition;
import tailcall.truffle.ast.Expr;
import tailcall.truffle.ast.Let;
import tailcall.truffle.ast.LocalFunction;
import tailcall.truffle.ast.NewFlag;
import tailcall.truffle.ast.Program;
import tailcall.truffle.ast.TerminalContinuation;
import tailcall.truffle.ast.Variable;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 为每个顶层定义安装蹦床。
 *
 * <pre>
 * (defn f [p... k]
 *   (let [flag (new-flag)]
 *     (letfn [(f$self [p... k] thunk)]
 *       (apply-k (tramp (f$self p... (terminal flag)) flag) k))))
 * </pre>
 *
 * 每次激活拥有独立的完成标志；函数体内的自调用指向局部函数而不是外层定义。
 */
public final class TrampolineInserter {
  private static final Logger LOGGER = Logger.getLogger(TrampolineInserter.class.getName());

  private final FreshNames names;
  private final String tramp;
  private final String applyK;

  public TrampolineInserter(FreshNames names, String tramp, String applyK) {
    this.names = names;
    this.tramp = tramp;
    this.applyK = applyK;
  }

  public Expr insert(Expr expr) {
    if (expr instanceof Program program) {
      List<Expr> forms = new ArrayList<>(program.forms().size());
      for (Expr form : program.forms()) {
        forms.add(insert(form));
      }
      return new Program(forms);
    }
    if (expr instanceof Definition def) {
      return insertDefinition(def);
    }
    // 顶层调用等其它形式原样保留
    return expr;
  }

  private Definition insertDefinition(Definition def) {
    if (!def.hasSelfName() || def.params().isEmpty()) {
      throw new InvariantViolationException("Definition was not CPS-converted", def);
    }
    List<String> params = def.params();
    String k = params.get(params.size() - 1);
    String flag = names.fresh("flag");

    List<Expr> initialArgs = new ArrayList<>(params.size());
    for (String p : params.subList(0, params.size() - 1)) {
      initialArgs.add(new Variable(p));
    }
    initialArgs.add(new TerminalContinuation(new Variable(flag)));

    Expr initial = new Application(new Variable(def.selfName()), initialArgs);
    Expr loop = new Application(new Variable(tramp), List.of(initial, new Variable(flag)));
    Expr deliver = new Application(new Variable(applyK), List.of(loop, new Variable(k)));

    Expr body = new Let(flag, new NewFlag(),
        new LocalFunction(def.selfName(), params, def.body(), deliver));
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine(String.format("trampoline installed for %s (self=%s, flag=%s)", def.name(), def.selfName(), flag));
    }
    return def.withBody(body);
  }
}
