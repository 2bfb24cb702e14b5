package tailcall.truffle.emit;

import static org.junit.jupiter.api.Assertions.*;
import static tailcall.truffle.ast.Trees.*;

import tailcall.truffle.ast.Abstraction;
import tailcall.truffle.ast.Continuation;
import tailcall.truffle.ast.ContinuationApplication;
import tailcall.truffle.ast.Intrinsic;
import tailcall.truffle.ast.Let;
import tailcall.truffle.ast.LocalFunction;
import tailcall.truffle.ast.NewFlag;
import tailcall.truffle.ast.Program;
import tailcall.truffle.ast.TerminalContinuation;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceEmitterTest {

  @Test
  void sourceForms() {
    assertEquals("(defn countdown [n] (if (zero? n) 0 (countdown (dec n))))", SourceEmitter.emit(countdown()));
    assertEquals("(fn [x y] (+ x y 2.5))", SourceEmitter.emit(fn(List.of("x", "y"),
        op("+", var("x"), var("y"), new tailcall.truffle.ast.Literal(2.5)))));
    assertEquals("(do (f true) 1)", SourceEmitter.emit(new Program(List.of(call("f", bool(true)), num(1)))));
  }

  @Test
  void continuationForms() {
    assertEquals("(fn [s$1] (k s$1))",
        SourceEmitter.emit(new Continuation("s$1", new ContinuationApplication(var("k"), var("s$1")))));
    assertEquals("(fn [] 1)", SourceEmitter.emit(Abstraction.thunk(num(1))));
  }

  @Test
  void targetForms() {
    String out = SourceEmitter.emit(new Let("tramp$1", new Intrinsic(Intrinsic.Kind.TRAMPOLINE),
        new Let("flag$2", new NewFlag(),
            new LocalFunction("f$3", List.of("k"), Abstraction.thunk(var("k")),
                call("f$3", new TerminalContinuation(var("flag$2")))))));
    assertEquals("(let [tramp$1 (intrinsic trampoline)] (let [flag$2 (new-flag)] "
        + "(letfn [(f$3 [k] (fn [] k))] (f$3 (terminal flag$2)))))", out);
  }
}
